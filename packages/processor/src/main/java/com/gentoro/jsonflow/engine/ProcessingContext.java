package com.gentoro.jsonflow.engine;

import com.gentoro.jsonflow.tree.PathSegment;
import java.util.List;

/**
 * What a transform knows about the item it is called for.
 *
 * @param index position of the item in the flattened sequence
 * @param total number of items in the job
 * @param depth nesting depth of the item, 0 for the root
 * @param path keys and indices from the root
 * @param startTimeMillis wall-clock time the job started, epoch millis
 */
public record ProcessingContext(
    int index, int total, int depth, List<PathSegment> path, long startTimeMillis) {
  public ProcessingContext {
    path = List.copyOf(path);
  }

  public String pathString() {
    return PathSegment.render(path);
  }
}
