package com.gentoro.jsonflow.tree;

import com.gentoro.jsonflow.exception.InvalidOptionsException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Splits an ordered list into contiguous, fixed-size batches. */
public final class Batcher {
  private Batcher() {}

  /**
   * Partition {@code items} into slices of {@code batchSize}; only the last slice may be shorter.
   * The returned batches are read-only views over {@code items}.
   */
  public static <T> List<List<T>> batch(List<T> items, int batchSize) {
    if (batchSize <= 0) {
      throw new InvalidOptionsException("batchSize must be positive, was " + batchSize);
    }
    List<List<T>> batches = new ArrayList<>(batchCount(items.size(), batchSize));
    for (int from = 0; from < items.size(); from += batchSize) {
      int to = Math.min(from + batchSize, items.size());
      batches.add(Collections.unmodifiableList(items.subList(from, to)));
    }
    return batches;
  }

  public static int batchCount(int itemCount, int batchSize) {
    if (batchSize <= 0) {
      throw new InvalidOptionsException("batchSize must be positive, was " + batchSize);
    }
    return (itemCount + batchSize - 1) / batchSize;
  }
}
