package com.gentoro.jsonflow;

import com.gentoro.jsonflow.exception.StateException;
import com.gentoro.jsonflow.jobs.IncrementalProcessor;
import com.gentoro.jsonflow.jobs.ProcessingListener;
import com.gentoro.jsonflow.jobs.ProcessingOptions;
import com.gentoro.jsonflow.logging.LoggingService;
import org.apache.commons.configuration2.Configuration;

/**
 * Entry point for applications embedding the processor. Loads configuration, applies the
 * configured log levels and hands out processors preset with the configured default options.
 */
public class JsonFlow {

  private static final org.slf4j.Logger log = LoggingService.getLogger(JsonFlow.class);

  private final String configFile;
  private ConfigurationProvider configurationProvider;
  private ProcessingOptions defaultOptions;

  /** Use {@code application.yaml} from the classpath. */
  public JsonFlow() {
    this(null);
  }

  /** Use the given YAML file; {@code null} falls back to the classpath resource. */
  public JsonFlow(String configFile) {
    this.configFile = configFile;
  }

  public JsonFlow initialize() {
    this.configurationProvider = new ConfigurationProvider(configFile);
    // Apply logging levels as early as possible
    LoggingService.applyConfiguration(configuration());
    this.defaultOptions = ProcessingOptions.fromConfiguration(configuration());
    log.info("jsonflow initialized with {}", defaultOptions);
    return this;
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("JsonFlow not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public ProcessingOptions defaultOptions() {
    if (defaultOptions == null) {
      throw new StateException("JsonFlow not initialized. Call initialize() first.");
    }
    return defaultOptions;
  }

  public IncrementalProcessor newProcessor() {
    return newProcessor(defaultOptions(), ProcessingListener.NONE);
  }

  public IncrementalProcessor newProcessor(ProcessingListener listener) {
    return newProcessor(defaultOptions(), listener);
  }

  public IncrementalProcessor newProcessor(
      ProcessingOptions options, ProcessingListener listener) {
    return new IncrementalProcessor(options, listener);
  }
}
