package com.gentoro.jsonflow;

import com.gentoro.jsonflow.exception.ConfigurationException;
import com.gentoro.jsonflow.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.slf4j.Logger;

/**
 * Loads the YAML configuration. Without an explicit file, {@code application.yaml} is read from the
 * classpath; if that resource is missing an empty configuration is used and every option keeps its
 * default.
 */
public class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_RESOURCE = "application.yaml";

  private final YAMLConfiguration config;

  public ConfigurationProvider(String configFile) {
    this.config = configFile == null ? loadResource(DEFAULT_RESOURCE) : loadFile(Path.of(configFile));
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration loadResource(String resource) {
    InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      log.debug("No {} on the classpath, using defaults", resource);
      return new YAMLConfiguration();
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return read(reader, "classpath:" + resource);
    } catch (IOException e) {
      throw new ConfigurationException("Could not read classpath:" + resource, e);
    }
  }

  private static YAMLConfiguration loadFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigurationException("Configuration file not found: " + file.toAbsolutePath());
    }
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(reader, file.toString());
    } catch (IOException e) {
      throw new ConfigurationException("Could not read " + file.toAbsolutePath(), e);
    }
  }

  private static YAMLConfiguration read(Reader reader, String source) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigurationException("Malformed configuration in " + source, e);
    }
    log.debug("Loaded configuration from {}", source);
    return yaml;
  }
}
