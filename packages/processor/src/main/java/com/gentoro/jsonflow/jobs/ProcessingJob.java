package com.gentoro.jsonflow.jobs;

import com.gentoro.jsonflow.engine.ProcessingResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One invocation of the processor. Package-private; callers only see it through {@link
 * IncrementalProcessor}.
 *
 * <p>The cancellation flag is the only field written from outside the driving thread. Results are
 * owned by the driving thread.
 */
final class ProcessingJob {
  final String id = UUID.randomUUID().toString();
  final ProcessingOptions options;
  final Instant createdAt = Instant.now();

  volatile Instant startedAt;
  volatile Instant finishedAt;
  volatile JobStatus status = JobStatus.IDLE;

  final List<ProcessingResult> results = new ArrayList<>();

  private final AtomicBoolean cancelRequested = new AtomicBoolean();
  private final CountDownLatch abortSignal = new CountDownLatch(1);

  ProcessingJob(ProcessingOptions options) {
    this.options = options;
  }

  void markRunning() {
    startedAt = Instant.now();
    status = JobStatus.RUNNING;
  }

  void finish(JobStatus finalStatus) {
    status = finalStatus;
    finishedAt = Instant.now();
  }

  /** Request cooperative cancellation; takes effect at the next batch boundary. */
  void requestCancel() {
    if (cancelRequested.compareAndSet(false, true)) {
      abortSignal.countDown();
    }
  }

  /** True once cancellation was requested or the driving thread was interrupted. */
  boolean isCancelled() {
    return cancelRequested.get() || Thread.currentThread().isInterrupted();
  }

  /**
   * Wait between batches. Returns early when cancellation is requested. An interrupt is preserved
   * on the thread and so also counts as cancellation.
   */
  void pause(long delayMs) {
    try {
      abortSignal.await(delayMs, TimeUnit.MILLISECONDS);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }
}
