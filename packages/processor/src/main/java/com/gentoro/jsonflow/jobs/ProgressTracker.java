package com.gentoro.jsonflow.jobs;

import com.gentoro.jsonflow.engine.ProcessingResult;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Keeps the running counters of one job and turns them into {@link ProcessingState} snapshots.
 * Confined to the thread driving the job.
 */
public final class ProgressTracker {
  private static final String UNKNOWN_ERROR = "Unknown error";

  private final int total;
  private final int totalBatches;
  private final LongSupplier nanoClock;
  private final long startNanos;
  private final List<ProcessingError> errors = new ArrayList<>();

  private int processed;
  private int currentBatch;
  private double speed;
  private double estimatedTimeRemainingMs;
  private ProcessingState state;

  public ProgressTracker(int total, int totalBatches) {
    this(total, totalBatches, System::nanoTime);
  }

  public ProgressTracker(int total, int totalBatches, LongSupplier nanoClock) {
    this.total = total;
    this.totalBatches = totalBatches;
    this.nanoClock = nanoClock;
    this.startNanos = nanoClock.getAsLong();
    this.state = snapshot(0);
  }

  public ProcessingState current() {
    return state;
  }

  /** Account for a finished batch. {@code batchIndex} is zero-based. */
  public ProcessingState update(List<ProcessingResult> batchResults, int batchIndex) {
    processed = Math.min(total, processed + batchResults.size());
    currentBatch = batchIndex + 1;

    for (ProcessingResult result : batchResults) {
      if (!result.success()) {
        errors.add(
            new ProcessingError(
                result.index(), result.error() == null ? UNKNOWN_ERROR : result.error()));
      }
    }

    long elapsedNanos = nanoClock.getAsLong() - startNanos;
    if (elapsedNanos > 0) {
      speed = processed / (elapsedNanos / (double) TimeUnit.SECONDS.toNanos(1));
    }
    if (speed > 0) {
      estimatedTimeRemainingMs = (total - processed) / speed * 1000d;
    }

    state = snapshot(percent());
    return state;
  }

  /** Final snapshot of a job that ran all its batches. */
  public ProcessingState complete() {
    state = snapshot(total == 0 ? 100 : percent());
    return state;
  }

  private int percent() {
    if (total == 0) {
      return 100;
    }
    return (int) Math.round(100d * processed / total);
  }

  private ProcessingState snapshot(int progress) {
    return new ProcessingState(
        total,
        processed,
        progress,
        currentBatch,
        totalBatches,
        speed,
        estimatedTimeRemainingMs,
        errors);
  }
}
