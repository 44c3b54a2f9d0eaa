package com.gentoro.jsonflow.jobs;

import java.util.List;

/**
 * Immutable snapshot of a job's progress. A new snapshot is produced after every batch.
 *
 * @param total number of work items in the job
 * @param processed items processed so far, never decreasing
 * @param progress {@code round(100 * processed / total)}, 100 for an empty job once complete
 * @param currentBatch number of batches completed
 * @param totalBatches number of batches in the job
 * @param speed items per second since the job started
 * @param estimatedTimeRemainingMs remaining items divided by speed, in milliseconds
 * @param errors failed items in encounter order
 */
public record ProcessingState(
    int total,
    int processed,
    int progress,
    int currentBatch,
    int totalBatches,
    double speed,
    double estimatedTimeRemainingMs,
    List<ProcessingError> errors) {

  private static final ProcessingState INITIAL = new ProcessingState(0, 0, 0, 0, 0, 0, 0, List.of());

  public ProcessingState {
    errors = List.copyOf(errors);
  }

  /** The all-zero state reported before any job has started. */
  public static ProcessingState initial() {
    return INITIAL;
  }
}
