package com.gentoro.onepivot.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.gentoro.onepivot.config.EngineConfigurationProvider;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  @TempDir Path tempDir;

  private static Level levelOf(String name) {
    return ((Logger) LoggerFactory.getLogger(name)).getLevel();
  }

  @Test
  void appliesFlatKeys() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("logging.levels.com.example.flat", "WARN");
    LoggingService.applyConfiguration(cfg);
    assertEquals(Level.WARN, levelOf("com.example.flat"));
  }

  @Test
  void appliesYamlKeysWithDots() throws Exception {
    Path file = tempDir.resolve("levels.yaml");
    Files.writeString(file, "logging:\n  levels:\n    com.example.yaml: ERROR\n");
    LoggingService.applyConfiguration(new EngineConfigurationProvider(file).configuration());
    assertEquals(Level.ERROR, levelOf("com.example.yaml"));
  }

  @Test
  void ignoresNullConfiguration() {
    assertDoesNotThrow(() -> LoggingService.applyConfiguration(null));
  }
}
