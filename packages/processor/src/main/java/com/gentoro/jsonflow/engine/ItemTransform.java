package com.gentoro.jsonflow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Function applied to every work item of a job.
 *
 * <p>Implementations receive the caller's nodes directly and must not modify them. When a job runs
 * with worker threads the same instance is called from several threads at once.
 */
@FunctionalInterface
public interface ItemTransform {

  /** Returns every value unchanged. Used when no transform is configured. */
  ItemTransform IDENTITY = (value, context) -> TransformResult.success(value);

  /** Returns every value unchanged, annotated with its index, depth and dotted path. */
  ItemTransform ANNOTATING =
      (value, context) -> {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("index", context.index());
        metadata.put("depth", context.depth());
        metadata.put("path", context.pathString());
        return TransformResult.success(value, metadata);
      };

  TransformResult apply(JsonNode value, ProcessingContext context) throws Exception;

  /** Resolve a transform by its configuration name: {@code identity} or {@code annotate}. */
  static ItemTransform named(String name) {
    if (name == null || name.isBlank() || "identity".equalsIgnoreCase(name.trim())) {
      return IDENTITY;
    }
    if ("annotate".equalsIgnoreCase(name.trim())) {
      return ANNOTATING;
    }
    throw new IllegalArgumentException("Unknown transform: " + name);
  }
}
