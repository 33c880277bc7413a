package com.gentoro.onepivot.export;

/** Target formats an export can be requested in; only some have an exporter. */
public enum ExportFormat {
  CSV("csv"),
  TSV("tsv"),
  JSON("json"),
  EXCEL("xlsx"),
  PDF("pdf"),
  XML("xml"),
  YAML("yaml"),
  HTML("html"),
  POWER_BI("pbix");

  private final String fileExtension;

  ExportFormat(String fileExtension) {
    this.fileExtension = fileExtension;
  }

  public String getFileExtension() {
    return fileExtension;
  }
}
