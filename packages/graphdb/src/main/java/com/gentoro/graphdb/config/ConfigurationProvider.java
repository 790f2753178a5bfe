package com.gentoro.graphdb.config;

import com.gentoro.graphdb.exception.ConfigException;
import com.gentoro.graphdb.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;

/**
 * Loads the YAML configuration used to open a graph database.
 *
 * <p>Resolution order: an explicit file, otherwise the {@value #DEFAULT_RESOURCE} classpath
 * resource, otherwise an empty configuration. System properties prefixed with {@value
 * #SYSTEM_PROPERTY_PREFIX} override loaded values, e.g. {@code -Dgraphdb.graph.path=/tmp/g.json}
 * sets {@code graph.path}.
 */
public class ConfigurationProvider {
  public static final String DEFAULT_RESOURCE = "graphdb.yaml";
  public static final String SYSTEM_PROPERTY_PREFIX = "graphdb.";

  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  private final YAMLConfiguration configuration;

  /** Configuration from the default classpath resource. */
  public ConfigurationProvider() {
    this.configuration = readClasspath(DEFAULT_RESOURCE);
    applyOverrides(System.getProperties());
  }

  /** Configuration from an explicit YAML file; fails if the file cannot be read. */
  public ConfigurationProvider(Path file) {
    this.configuration = readFile(file);
    applyOverrides(System.getProperties());
  }

  public Configuration config() {
    return configuration;
  }

  void applyOverrides(Properties properties) {
    for (String name : properties.stringPropertyNames()) {
      if (!name.startsWith(SYSTEM_PROPERTY_PREFIX)) continue;
      String key = name.substring(SYSTEM_PROPERTY_PREFIX.length());
      if (key.isBlank()) continue;
      log.debug("Configuration override from system property: {}", key);
      configuration.setProperty(key, properties.getProperty(name));
    }
  }

  private static YAMLConfiguration readFile(Path file) {
    if (file == null) {
      throw new ConfigException("Configuration file path must not be null");
    }
    log.debug("Loading configuration from {}", file);
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      yaml.read(reader);
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Could not read configuration file " + file, e)
          .withContext("path", file.toString());
    }
    return yaml;
  }

  private static YAMLConfiguration readClasspath(String resource) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = ConfigurationProvider.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) {
        log.debug("No {} on the classpath, using defaults", resource);
        return yaml;
      }
      yaml.read(new InputStreamReader(in, StandardCharsets.UTF_8));
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Could not read classpath configuration " + resource, e);
    }
    return yaml;
  }
}
