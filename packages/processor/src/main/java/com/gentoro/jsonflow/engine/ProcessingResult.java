package com.gentoro.jsonflow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;

/**
 * Outcome of processing one work item.
 *
 * @param index index of the originating work item
 * @param value transformed value; {@code null} when the transform threw
 * @param success whether the transform succeeded
 * @param error failure message, {@code null} on success
 * @param metadata metadata attached by the transform, may be {@code null}
 */
public record ProcessingResult(
    int index, JsonNode value, boolean success, String error, Map<String, Object> metadata) {

  static ProcessingResult of(int index, TransformResult result) {
    return new ProcessingResult(
        index, result.value(), result.success(), result.error(), result.metadata());
  }

  static ProcessingResult failed(int index, String error) {
    return new ProcessingResult(index, null, false, error, null);
  }
}
