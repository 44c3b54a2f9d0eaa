package com.gentoro.jsonflow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Value returned by an {@link ItemTransform}. A transform may report a failure either by throwing
 * or by returning a result with {@code success == false}.
 */
public record TransformResult(
    JsonNode value, boolean success, String error, Map<String, Object> metadata) {

  public TransformResult {
    metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static TransformResult success(JsonNode value) {
    return new TransformResult(value, true, null, null);
  }

  public static TransformResult success(JsonNode value, Map<String, Object> metadata) {
    return new TransformResult(value, true, null, metadata);
  }

  public static TransformResult failure(String error) {
    return new TransformResult(null, false, error, null);
  }
}
