package com.gentoro.jsonflow.tree;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * A node selected for processing.
 *
 * @param index position in the flattened sequence
 * @param value the node itself, shared with the caller's tree and never modified
 * @param path keys and indices leading from the root to the node
 */
public record WorkItem(int index, JsonNode value, List<PathSegment> path) {
  public WorkItem {
    Objects.requireNonNull(value, "value");
    path = List.copyOf(path);
  }

  /** Nesting depth; the root is at depth 0. */
  public int depth() {
    return path.size();
  }

  public String pathString() {
    return PathSegment.render(path);
  }
}
