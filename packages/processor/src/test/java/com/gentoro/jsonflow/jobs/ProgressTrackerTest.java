package com.gentoro.jsonflow.jobs;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.IntNode;
import com.gentoro.jsonflow.engine.ProcessingResult;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ProgressTrackerTest {

  private final AtomicLong clock = new AtomicLong(1_000L);

  private static ProcessingResult ok(int index) {
    return new ProcessingResult(index, IntNode.valueOf(index), true, null, null);
  }

  private static ProcessingResult failed(int index, String error) {
    return new ProcessingResult(index, null, false, error, null);
  }

  private void advanceMillis(long millis) {
    clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
  }

  @Test
  @DisplayName("initial snapshot carries totals and zero counters")
  void initialSnapshot() {
    ProgressTracker tracker = new ProgressTracker(10, 5, clock::get);

    ProcessingState s = tracker.current();
    assertEquals(10, s.total());
    assertEquals(5, s.totalBatches());
    assertEquals(0, s.processed());
    assertEquals(0, s.progress());
    assertEquals(0, s.currentBatch());
    assertTrue(s.errors().isEmpty());
  }

  @Test
  @DisplayName("speed and remaining time follow elapsed time")
  void speedAndEta() {
    ProgressTracker tracker = new ProgressTracker(10, 5, clock::get);

    advanceMillis(1_000);
    ProcessingState s = tracker.update(List.of(ok(0), ok(1)), 0);

    assertEquals(2, s.processed());
    assertEquals(20, s.progress());
    assertEquals(1, s.currentBatch());
    assertEquals(2.0, s.speed(), 1e-9);
    assertEquals(4_000.0, s.estimatedTimeRemainingMs(), 1e-6);
  }

  @Test
  @DisplayName("no elapsed time leaves speed and estimate untouched")
  void zeroElapsedIsGuarded() {
    ProgressTracker tracker = new ProgressTracker(4, 2, clock::get);

    ProcessingState s = tracker.update(List.of(ok(0), ok(1)), 0);

    assertEquals(0.0, s.speed());
    assertEquals(0.0, s.estimatedTimeRemainingMs());
    assertFalse(Double.isNaN(s.speed()));
    assertEquals(50, s.progress());
  }

  @Test
  @DisplayName("progress is rounded and reaches 100 on the last batch")
  void progressRounding() {
    ProgressTracker tracker = new ProgressTracker(3, 3, clock::get);

    advanceMillis(10);
    assertEquals(33, tracker.update(List.of(ok(0)), 0).progress());
    advanceMillis(10);
    assertEquals(67, tracker.update(List.of(ok(1)), 1).progress());
    advanceMillis(10);
    ProcessingState last = tracker.update(List.of(ok(2)), 2);
    assertEquals(100, last.progress());
    assertEquals(3, last.currentBatch());
    assertEquals(0.0, last.estimatedTimeRemainingMs());
  }

  @Test
  @DisplayName("errors accumulate in encounter order without deduplication")
  void errorsAccumulate() {
    ProgressTracker tracker = new ProgressTracker(5, 2, clock::get);

    advanceMillis(5);
    tracker.update(List.of(ok(0), failed(1, "boom"), failed(2, "boom")), 0);
    advanceMillis(5);
    ProcessingState s = tracker.update(List.of(failed(3, null), ok(4)), 1);

    assertEquals(
        List.of(
            new ProcessingError(1, "boom"),
            new ProcessingError(2, "boom"),
            new ProcessingError(3, "Unknown error")),
        s.errors());
  }

  @Test
  @DisplayName("snapshots are immutable and independent")
  void snapshotsAreImmutable() {
    ProgressTracker tracker = new ProgressTracker(2, 2, clock::get);

    advanceMillis(5);
    ProcessingState first = tracker.update(List.of(failed(0, "x")), 0);
    advanceMillis(5);
    tracker.update(List.of(failed(1, "y")), 1);

    assertEquals(1, first.errors().size());
    assertThrows(
        UnsupportedOperationException.class, () -> first.errors().add(new ProcessingError(9, "z")));
  }

  @Test
  @DisplayName("an empty job completes at 100 percent")
  void emptyJobCompletes() {
    ProgressTracker tracker = new ProgressTracker(0, 0, clock::get);

    assertEquals(0, tracker.current().progress());
    assertEquals(100, tracker.complete().progress());
  }

  @Test
  @DisplayName("processed never exceeds total")
  void processedIsCapped() {
    ProgressTracker tracker = new ProgressTracker(1, 1, clock::get);

    advanceMillis(1);
    ProcessingState s = tracker.update(List.of(ok(0), ok(1)), 0);

    assertEquals(1, s.processed());
    assertEquals(100, s.progress());
  }
}
