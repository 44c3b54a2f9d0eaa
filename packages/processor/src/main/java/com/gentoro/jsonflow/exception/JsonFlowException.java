package com.gentoro.jsonflow.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception of the library. Carries a {@link JsonFlowErrorCode} and an optional
 * map of contextual values that are useful when logging the failure.
 */
public class JsonFlowException extends RuntimeException {
  private final JsonFlowErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public JsonFlowException(JsonFlowErrorCode code, String message) {
    super(message);
    this.code = code == null ? JsonFlowErrorCode.UNKNOWN : code;
  }

  public JsonFlowException(JsonFlowErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code == null ? JsonFlowErrorCode.UNKNOWN : code;
  }

  public JsonFlowErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a contextual value, returning this exception for chaining. */
  public JsonFlowException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
