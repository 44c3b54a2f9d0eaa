package com.gentoro.jsonflow.jobs;

import com.gentoro.jsonflow.engine.ProcessingResult;
import java.util.List;

/**
 * Receives lifecycle notifications of a job, on the thread that drives it. Every method defaults
 * to a no-op. A listener that throws is logged and otherwise ignored.
 *
 * <p>Order for a job that runs to the end: {@code onStart}, then per batch {@code onProgress}
 * followed by {@code onPartial} (only with partial results enabled), then {@code onComplete}. An
 * aborted job ends with {@code onAbort} instead of {@code onComplete}.
 */
public interface ProcessingListener {

  ProcessingListener NONE = new ProcessingListener() {};

  default void onStart(ProcessingState state) {}

  default void onProgress(ProcessingState state) {}

  /** Results of the batch that just finished, in item order. */
  default void onPartial(List<ProcessingResult> batchResults) {}

  default void onComplete(List<ProcessingResult> results) {}

  default void onAbort(ProcessingState state) {}

  /** An unexpected error is about to be thrown from the processing call. */
  default void onError(Throwable error) {}
}
