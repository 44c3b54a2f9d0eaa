package com.gentoro.jsonflow.tree;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.jsonflow.exception.InvalidOptionsException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BatcherTest {

  @Test
  @DisplayName("splits into contiguous slices with a shorter last batch")
  void splitsContiguously() {
    List<List<Integer>> batches = Batcher.batch(List.of(1, 2, 3, 4, 5), 2);

    assertEquals(List.of(List.of(1, 2), List.of(3, 4), List.of(5)), batches);
  }

  @Test
  @DisplayName("batch size larger than input gives a single batch")
  void singleBatch() {
    assertEquals(List.of(List.of(1, 2, 3)), Batcher.batch(List.of(1, 2, 3), 1000));
  }

  @Test
  @DisplayName("empty input gives no batches")
  void emptyInput() {
    assertTrue(Batcher.batch(List.of(), 10).isEmpty());
    assertEquals(0, Batcher.batchCount(0, 10));
  }

  @Test
  @DisplayName("batch count rounds up")
  void batchCount() {
    assertEquals(3, Batcher.batchCount(5, 2));
    assertEquals(1, Batcher.batchCount(1, 1));
    assertEquals(10, Batcher.batchCount(100, 10));
  }

  @Test
  @DisplayName("non-positive batch size is rejected")
  void rejectsInvalidSize() {
    assertThrows(InvalidOptionsException.class, () -> Batcher.batch(List.of(1), 0));
    assertThrows(InvalidOptionsException.class, () -> Batcher.batch(List.of(1), -3));
  }

  @Test
  @DisplayName("batches are read-only")
  void batchesAreReadOnly() {
    List<List<Integer>> batches = Batcher.batch(List.of(1, 2, 3), 2);

    assertThrows(UnsupportedOperationException.class, () -> batches.get(0).add(9));
  }
}
