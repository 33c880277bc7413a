package com.gentoro.onepivot.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.onepivot.config.PivotConfiguration;
import com.gentoro.onepivot.engine.PivotAxis;
import com.gentoro.onepivot.engine.PivotCell;
import com.gentoro.onepivot.engine.PivotHeader;
import com.gentoro.onepivot.engine.PivotResult;
import com.gentoro.onepivot.exception.ErrorDetails;
import com.gentoro.onepivot.exception.PivotExportException;
import com.gentoro.onepivot.field.PivotField;
import com.gentoro.onepivot.utility.JacksonUtility;
import com.gentoro.onepivot.value.Value;
import java.util.List;

/**
 * Structural JSON rendering of a whole result: configuration descriptor, both header axes with
 * their arena links, cells, metrics, warnings and errors.
 *
 * <p>Functions held by fields (extractors, formatters) are not serializable and are left out.
 */
public class JsonPivotExporter implements PivotExporter {
  private final ObjectMapper mapper;

  public JsonPivotExporter() {
    this(JacksonUtility.getJsonMapper());
  }

  public JsonPivotExporter(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  public ExportFormat format() {
    return ExportFormat.JSON;
  }

  @Override
  public <T> byte[] export(PivotResult<T> result, ExportConfiguration configuration) {
    try {
      return mapper.writeValueAsBytes(toTree(result, configuration));
    } catch (JsonProcessingException e) {
      throw new PivotExportException("Failed to write JSON export", e);
    }
  }

  <T> ObjectNode toTree(PivotResult<T> result, ExportConfiguration configuration) {
    PivotConfiguration<T> cfg = result.getConfiguration();
    ObjectNode root = mapper.createObjectNode();
    root.put("pivotId", cfg.getPivotId());
    root.put("title", cfg.getTitle());
    root.put("generatedAt", String.valueOf(result.getGeneratedAt()));
    root.put("sourceRecordCount", result.getSourceRecordCount());
    root.put("filteredRecordCount", result.getFilteredRecordCount());
    root.set("configuration", configurationNode(cfg));
    root.set("rowHeaders", axisNode(result.getRowAxis(), configuration));
    root.set("columnHeaders", axisNode(result.getColumnAxis(), configuration));

    ArrayNode cells = root.putArray("cells");
    for (PivotCell<T> cell : result.cells()) {
      if (configuration.includes(cell)) {
        cells.add(cellNode(cell));
      }
    }
    if (result.getMetrics() != null) {
      root.set("metrics", mapper.valueToTree(result.getMetrics()));
    }
    ArrayNode warnings = root.putArray("warnings");
    result.getWarnings().forEach(warnings::add);
    ArrayNode errors = root.putArray("errors");
    for (ErrorDetails details : result.getErrorDetails()) {
      JsonNode node = mapper.valueToTree(details);
      errors.add(node);
    }
    return root;
  }

  private <T> ObjectNode configurationNode(PivotConfiguration<T> cfg) {
    ObjectNode node = mapper.createObjectNode();
    node.set("rowFields", fieldsNode(cfg.getRowFields()));
    node.set("columnFields", fieldsNode(cfg.getColumnFields()));
    node.set("dataFields", fieldsNode(cfg.getDataFields()));
    node.set("filterFields", fieldsNode(cfg.getFilterFields()));
    node.put("enableSubtotals", cfg.isEnableSubtotals());
    node.put("enableGrandTotals", cfg.isEnableGrandTotals());
    node.put("enableCaching", cfg.isEnableCaching());
    if (cfg.getMaxCells() != null) {
      node.put("maxCells", cfg.getMaxCells());
    }
    return node;
  }

  private <T> ArrayNode fieldsNode(List<PivotField<T>> fields) {
    ArrayNode array = mapper.createArrayNode();
    for (PivotField<T> f : fields) {
      ObjectNode node = array.addObject();
      node.put("key", f.getKey());
      node.put("displayName", f.getDisplayName());
      node.put("kind", String.valueOf(f.getKind()));
      node.put("dataType", String.valueOf(f.getDataType()));
      node.put("aggregation", String.valueOf(f.getDefaultAggregation()));
      if (f.getFormat() != null && !f.getFormat().isEmpty()) {
        node.put("format", f.getFormat());
      }
    }
    return array;
  }

  private <T> ArrayNode axisNode(PivotAxis<T> axis, ExportConfiguration configuration) {
    ArrayNode array = mapper.createArrayNode();
    for (PivotHeader<T> header : axis.headers()) {
      if (!configuration.includes(header)) {
        continue;
      }
      ObjectNode node = array.addObject();
      node.put("index", header.getIndex());
      node.put("parentIndex", header.getParentIndex());
      node.put("path", header.getPath());
      node.set("value", valueNode(header.getValue()));
      node.put("formattedValue", header.getFormattedValue());
      node.put("field", header.getField() == null ? null : header.getField().getKey());
      node.put("level", header.getLevel());
      node.put("subtotal", header.isSubtotal());
      node.put("grandTotal", header.isGrandTotal());
      node.put("axisTotal", header.isAxisTotal());
      node.put("emptyGroup", header.isEmptyGroup());
      node.put("matchedCount", header.getMatchedCount());
      ArrayNode children = node.putArray("children");
      header.getChildIndices().forEach(children::add);
    }
    return array;
  }

  private <T> ObjectNode cellNode(PivotCell<T> cell) {
    ObjectNode node = mapper.createObjectNode();
    node.put("key", cell.key());
    node.put("row", cell.rowHeader().getPath());
    node.put("column", cell.columnHeader().getPath());
    node.put("measure", cell.measure().getKey());
    node.set("value", valueNode(cell.value()));
    node.put("formattedValue", cell.formattedValue());
    node.put("matchedCount", cell.matchedCount());
    node.put("empty", cell.isEmpty());
    node.put("rowTotal", cell.isRowTotal());
    node.put("columnTotal", cell.isColumnTotal());
    node.put("grandTotal", cell.isGrandTotal());
    return node;
  }

  private JsonNode valueNode(Value value) {
    if (value instanceof Value.NumberValue n) {
      return mapper.getNodeFactory().numberNode(n.value());
    }
    if (value instanceof Value.BoolValue b) {
      return mapper.getNodeFactory().booleanNode(b.value());
    }
    if (value.isNull()) {
      return mapper.getNodeFactory().nullNode();
    }
    return mapper.getNodeFactory().textNode(value.asText());
  }
}
