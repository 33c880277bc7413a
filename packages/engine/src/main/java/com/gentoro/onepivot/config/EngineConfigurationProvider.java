package com.gentoro.onepivot.config;

import com.gentoro.onepivot.exception.OnePivotErrorCode;
import com.gentoro.onepivot.exception.OnePivotException;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Loads the engine configuration.
 *
 * <p>The bundled {@code onepivot.yaml} on the classpath provides the defaults. An optional
 * override file is layered on top: keys it defines win, everything else falls through to the
 * bundled file.
 */
public class EngineConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.onepivot.logging.LoggingService.getLogger(EngineConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "onepivot.yaml";

  private final CompositeConfiguration configuration = new CompositeConfiguration();

  public EngineConfigurationProvider() {
    this(null);
  }

  public EngineConfigurationProvider(Path overrideFile) {
    if (overrideFile != null) {
      configuration.addConfiguration(readFile(overrideFile));
      log.debug("Loaded engine configuration override from {}", overrideFile);
    }
    configuration.addConfiguration(readClasspath(DEFAULT_RESOURCE));
  }

  public Configuration configuration() {
    return configuration;
  }

  public EngineSettings settings() {
    return EngineSettings.fromConfiguration(configuration);
  }

  private static YAMLConfiguration readFile(Path file) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (Reader reader = Files.newBufferedReader(file)) {
      yaml.read(reader);
      return yaml;
    } catch (IOException | ConfigurationException e) {
      throw new OnePivotException(
          OnePivotErrorCode.CONFIGURATION_ERROR,
          "Failed to read engine configuration from " + file,
          e);
    }
  }

  private static YAMLConfiguration readClasspath(String resource) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    ClassLoader loader = EngineConfigurationProvider.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        log.warn("Engine configuration resource '{}' not found; using built-in defaults", resource);
        return yaml;
      }
      yaml.read(in);
      return yaml;
    } catch (IOException | ConfigurationException e) {
      throw new OnePivotException(
          OnePivotErrorCode.CONFIGURATION_ERROR,
          "Failed to read engine configuration resource " + resource,
          e);
    }
  }
}
