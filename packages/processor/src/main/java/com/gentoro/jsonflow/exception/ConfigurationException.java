package com.gentoro.jsonflow.exception;

/** Errors while loading or interpreting the application configuration. */
public class ConfigurationException extends JsonFlowException {
  public ConfigurationException(String message) {
    super(JsonFlowErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(JsonFlowErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
