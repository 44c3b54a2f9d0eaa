package com.gentoro.jsonflow.jobs;

/** Lifecycle state of a processing job. */
public enum JobStatus {
  /** No job has started yet. */
  IDLE,
  /** Batches are being processed. */
  RUNNING,
  /** Every batch was processed. */
  COMPLETED,
  /** Stopped at a batch boundary after {@code abort()}; results are partial. */
  ABORTED,
  /** Input could not be decoded, or an unexpected error escaped the batch loop. */
  FAILED
}
