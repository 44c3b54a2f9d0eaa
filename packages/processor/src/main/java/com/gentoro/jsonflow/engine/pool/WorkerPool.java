package com.gentoro.jsonflow.engine.pool;

import com.gentoro.jsonflow.engine.ItemExecutor;
import com.gentoro.jsonflow.engine.ProcessingResult;
import com.gentoro.jsonflow.exception.ExceptionUtil;
import com.gentoro.jsonflow.exception.ProcessingException;
import com.gentoro.jsonflow.logging.LoggingService;
import com.gentoro.jsonflow.tree.WorkItem;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Bounded set of worker threads that runs the items of one batch in parallel.
 *
 * <p>A batch is cut into at most {@code workerCount} contiguous chunks, one task per chunk. Results
 * are reassembled by item index, so the returned list is in batch order whatever order the tasks
 * finished in. Chunks the pool refuses run on the calling thread instead; that fallback is logged
 * but not reported to the caller.
 */
public final class WorkerPool implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(WorkerPool.class);

  private static final AtomicInteger THREAD_SEQUENCE = new AtomicInteger();

  private final ExecutorService executor;
  private final int workerCount;

  WorkerPool(ExecutorService executor, int workerCount) {
    this.executor = executor;
    this.workerCount = workerCount;
  }

  /** Start {@code workerCount} threads eagerly, so that thread creation failures surface here. */
  public static PoolStart start(int workerCount) {
    if (workerCount <= 0) {
      return PoolStart.failed("workerCount must be positive, was " + workerCount, null);
    }
    ThreadPoolExecutor executor = null;
    try {
      executor =
          new ThreadPoolExecutor(
              workerCount,
              workerCount,
              0L,
              TimeUnit.MILLISECONDS,
              new LinkedBlockingQueue<>(),
              workerThreadFactory());
      executor.prestartAllCoreThreads();
      log.debug("Started worker pool with {} threads", workerCount);
      return PoolStart.started(new WorkerPool(executor, workerCount));
    } catch (RuntimeException | OutOfMemoryError e) {
      if (executor != null) {
        executor.shutdownNow();
      }
      return PoolStart.failed("Could not start worker threads: " + ExceptionUtil.messageOf(e), e);
    }
  }

  private static ThreadFactory workerThreadFactory() {
    return r -> {
      Thread t = new Thread(r, "jsonflow-worker-" + THREAD_SEQUENCE.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  public int workerCount() {
    return workerCount;
  }

  /**
   * Run {@code batch} across the pool and return one result per item, in batch order. Transform
   * failures are recorded per item and never thrown.
   *
   * <p>Every item is transformed exactly once. A chunk the pool rejects runs on the calling thread.
   * An interrupt does not stop the batch: the chunks already submitted are awaited and the
   * interrupt flag is restored afterwards. An {@link Error} raised inside a worker cancels the
   * remaining chunks and is rethrown unchanged.
   */
  public List<ProcessingResult> runBatchParallel(List<WorkItem> batch, ItemExecutor itemExecutor) {
    if (batch.isEmpty()) {
      return List.of();
    }
    int chunkSize = (batch.size() + workerCount - 1) / workerCount;
    List<List<WorkItem>> chunks = new ArrayList<>();
    for (int from = 0; from < batch.size(); from += chunkSize) {
      chunks.add(batch.subList(from, Math.min(from + chunkSize, batch.size())));
    }

    // null marks a chunk the pool refused
    List<Future<List<ProcessingResult>>> futures = new ArrayList<>(chunks.size());
    int rejected = 0;
    for (List<WorkItem> chunk : chunks) {
      try {
        futures.add(executor.submit(() -> itemExecutor.executeAll(chunk)));
      } catch (RejectedExecutionException e) {
        futures.add(null);
        rejected++;
      }
    }
    if (rejected > 0) {
      log.warn(
          "Worker pool rejected {} of {} chunks, running them on the calling thread",
          rejected,
          chunks.size());
    }

    List<ProcessingResult> results = new ArrayList<>(batch.size());
    boolean interrupted = false;
    try {
      for (int i = 0; i < chunks.size(); i++) {
        Future<List<ProcessingResult>> future = futures.get(i);
        if (future == null) {
          results.addAll(itemExecutor.executeAll(chunks.get(i)));
          continue;
        }
        while (true) {
          try {
            results.addAll(future.get());
            break;
          } catch (InterruptedException e) {
            interrupted = true;
          } catch (ExecutionException e) {
            cancelAll(futures);
            throw propagate(e.getCause(), batch.size());
          }
        }
      }
    } finally {
      if (interrupted) {
        log.debug("Interrupted while a batch of {} items was in flight", batch.size());
        Thread.currentThread().interrupt();
      }
    }
    results.sort(Comparator.comparingInt(ProcessingResult::index));
    return results;
  }

  private static RuntimeException propagate(Throwable cause, int batchSize) {
    log.error(
        "Worker failed on a batch of {} items: {} [{}]",
        batchSize,
        cause,
        ExceptionUtil.formatCompactStackTrace(cause));
    if (cause instanceof Error error) {
      throw error;
    }
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    return new ProcessingException("Worker failed: " + ExceptionUtil.messageOf(cause), cause);
  }

  private static void cancelAll(List<Future<List<ProcessingResult>>> futures) {
    for (Future<List<ProcessingResult>> future : futures) {
      if (future != null) {
        future.cancel(true);
      }
    }
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
