package com.gentoro.jsonflow.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.jsonflow.engine.ItemExecutor;
import com.gentoro.jsonflow.engine.ProcessingResult;
import com.gentoro.jsonflow.engine.pool.PoolStart;
import com.gentoro.jsonflow.engine.pool.WorkerPool;
import com.gentoro.jsonflow.engine.pool.WorkerPoolFactory;
import com.gentoro.jsonflow.exception.ExceptionUtil;
import com.gentoro.jsonflow.exception.ProcessingException;
import com.gentoro.jsonflow.exception.StateException;
import com.gentoro.jsonflow.exception.StreamDecodeException;
import com.gentoro.jsonflow.logging.LoggingService;
import com.gentoro.jsonflow.tree.Batcher;
import com.gentoro.jsonflow.tree.JsonTreeDecoder;
import com.gentoro.jsonflow.tree.NodeFlattener;
import com.gentoro.jsonflow.tree.WorkItem;
import java.io.InputStream;
import java.io.Reader;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Processes a JSON tree in batches, reporting progress after every batch and stopping early when
 * {@link #abort()} is called.
 *
 * <p>Each call flattens the tree into work items, splits them into batches and runs the batches
 * strictly one after another, either on the calling thread or fanned out to a worker pool.
 * Cancellation is checked before every batch; a batch that has started always finishes. The
 * returned list holds one result per processed item, in item order.
 *
 * <p>A processor runs one job at a time and can be reused for further jobs once a call returns.
 */
public final class IncrementalProcessor {
  private static final Logger log = LoggingService.getLogger(IncrementalProcessor.class);

  private final ProcessingOptions options;
  private final ProcessingListener listener;
  private final WorkerPoolFactory poolFactory;
  private final JsonTreeDecoder decoder;

  private final AtomicReference<ProcessingJob> currentJob = new AtomicReference<>();
  private volatile ProcessingJob lastJob;
  private volatile ProcessingState state = ProcessingState.initial();

  public IncrementalProcessor() {
    this(ProcessingOptions.defaults());
  }

  public IncrementalProcessor(ProcessingOptions options) {
    this(options, ProcessingListener.NONE);
  }

  public IncrementalProcessor(ProcessingOptions options, ProcessingListener listener) {
    this(options, listener, WorkerPoolFactory.DEFAULT);
  }

  public IncrementalProcessor(
      ProcessingOptions options, ProcessingListener listener, WorkerPoolFactory poolFactory) {
    this.options = Objects.requireNonNull(options, "options");
    this.listener = listener == null ? ProcessingListener.NONE : listener;
    this.poolFactory = poolFactory == null ? WorkerPoolFactory.DEFAULT : poolFactory;
    this.decoder = new JsonTreeDecoder();
  }

  /** Process {@code root} with {@code options} on a throwaway processor. */
  public static List<ProcessingResult> process(JsonNode root, ProcessingOptions options) {
    return new IncrementalProcessor(options).processData(root);
  }

  /** Decode and process {@code in} with {@code options} on a throwaway processor. */
  public static List<ProcessingResult> processStream(InputStream in, ProcessingOptions options) {
    return new IncrementalProcessor(options).processStream(in);
  }

  public ProcessingOptions options() {
    return options;
  }

  /**
   * Process {@code root} on the calling thread and return the results in item order. Returns a
   * partial list if {@link #abort()} was called while the job ran.
   *
   * @throws StateException if another job is running on this processor
   */
  public List<ProcessingResult> processData(JsonNode root) {
    ProcessingJob job = register();
    try {
      return run(job, root);
    } finally {
      release(job);
    }
  }

  /**
   * Read {@code in} to the end, decode it as UTF-8 JSON and process the resulting tree.
   *
   * @throws StreamDecodeException if the stream is empty, unreadable or not a single JSON document;
   *     no notification is emitted in that case
   */
  public List<ProcessingResult> processStream(InputStream in) {
    ProcessingJob job = register();
    try {
      return run(job, decode(job, () -> decoder.decode(in)));
    } finally {
      release(job);
    }
  }

  /** Character-stream variant of {@link #processStream(InputStream)}. */
  public List<ProcessingResult> processStream(Reader reader) {
    ProcessingJob job = register();
    try {
      return run(job, decode(job, () -> decoder.decode(reader)));
    } finally {
      release(job);
    }
  }

  /**
   * Run {@link #processData(JsonNode)} on a dedicated thread. The job is registered before this
   * method returns, so {@link #abort()} may be called immediately afterwards.
   */
  public Future<List<ProcessingResult>> submit(JsonNode root) {
    ProcessingJob job = register();
    ExecutorService executor =
        Executors.newSingleThreadExecutor(r -> new Thread(r, "jsonflow-job-" + job.id));
    try {
      return executor.submit(
          () -> {
            try {
              return run(job, root);
            } finally {
              release(job);
            }
          });
    } finally {
      executor.shutdown();
    }
  }

  /**
   * Request cooperative cancellation of the running job. The job stops before its next batch and
   * returns the results gathered so far. Does nothing when no job is running.
   */
  public void abort() {
    ProcessingJob job = currentJob.get();
    if (job == null) {
      log.debug("abort() called with no running job");
      return;
    }
    log.info("Abort requested for job {}", job.id);
    job.requestCancel();
  }

  /** Latest progress snapshot; all zeros before the first job. */
  public ProcessingState getState() {
    return state;
  }

  public JobStatus getStatus() {
    ProcessingJob job = lastJob;
    return job == null ? JobStatus.IDLE : job.status;
  }

  // --------------------------------------------------------------------
  // Job execution
  // --------------------------------------------------------------------

  private ProcessingJob register() {
    ProcessingJob job = new ProcessingJob(options);
    if (!currentJob.compareAndSet(null, job)) {
      throw new StateException("A job is already running on this processor");
    }
    lastJob = job;
    state = ProcessingState.initial();
    return job;
  }

  private void release(ProcessingJob job) {
    currentJob.compareAndSet(job, null);
  }

  private JsonNode decode(ProcessingJob job, Supplier<JsonNode> decoding) {
    try {
      return decoding.get();
    } catch (StreamDecodeException e) {
      job.finish(JobStatus.FAILED);
      log.warn("Job {} rejected input: {}", job.id, e.getMessage());
      throw e;
    }
  }

  private List<ProcessingResult> run(ProcessingJob job, JsonNode root) {
    WorkerPool pool = null;
    try {
      List<WorkItem> items = NodeFlattener.flatten(root, options.enableDeepProcessing());
      List<List<WorkItem>> batches = Batcher.batch(items, options.batchSize());
      ProgressTracker tracker = new ProgressTracker(items.size(), batches.size());

      job.markRunning();
      state = tracker.current();
      log.info(
          "Job {} started: {} items in {} batches ({})",
          job.id,
          items.size(),
          batches.size(),
          options);
      notifyListener("start", l -> l.onStart(tracker.current()));

      pool = startPool(job);
      ItemExecutor executor =
          new ItemExecutor(options.transform(), items.size(), job.startedAt.toEpochMilli());

      for (int batchIndex = 0; batchIndex < batches.size(); batchIndex++) {
        if (job.isCancelled()) {
          return abortJob(job, tracker);
        }

        List<WorkItem> batch = batches.get(batchIndex);
        List<ProcessingResult> batchResults =
            pool != null ? pool.runBatchParallel(batch, executor) : executor.executeAll(batch);
        job.results.addAll(batchResults);

        ProcessingState updated = tracker.update(batchResults, batchIndex);
        state = updated;
        log.debug(
            "Job {} batch {}/{} done: {} items, {} errors so far",
            job.id,
            updated.currentBatch(),
            updated.totalBatches(),
            batchResults.size(),
            updated.errors().size());
        notifyListener("progress", l -> l.onProgress(updated));

        if (options.enablePartialResults()) {
          List<ProcessingResult> partial = List.copyOf(batchResults);
          notifyListener("partial", l -> l.onPartial(partial));
        }

        if (options.batchDelayMs() > 0 && batchIndex < batches.size() - 1) {
          job.pause(options.batchDelayMs());
        }
      }

      state = tracker.complete();
      job.finish(JobStatus.COMPLETED);
      List<ProcessingResult> results = Collections.unmodifiableList(job.results);
      log.info(
          "Job {} completed: {} items, {} errors",
          job.id,
          state.processed(),
          state.errors().size());
      notifyListener("complete", l -> l.onComplete(results));
      return results;
    } catch (RuntimeException e) {
      job.finish(JobStatus.FAILED);
      log.error("Job {} failed: {}", job.id, e.toString());
      notifyListener("error", l -> l.onError(e));
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          t -> new ProcessingException("Job " + job.id + " failed: " + ExceptionUtil.messageOf(t), t));
    } catch (Error e) {
      job.finish(JobStatus.FAILED);
      log.error("Job {} failed with {}", job.id, e.toString());
      notifyListener("error", l -> l.onError(e));
      throw e;
    } finally {
      if (pool != null) {
        pool.close();
      }
    }
  }

  private List<ProcessingResult> abortJob(ProcessingJob job, ProgressTracker tracker) {
    ProcessingState snapshot = tracker.current();
    state = snapshot;
    job.finish(JobStatus.ABORTED);
    log.info(
        "Job {} aborted after {} of {} items", job.id, snapshot.processed(), snapshot.total());
    notifyListener("abort", l -> l.onAbort(snapshot));
    return Collections.unmodifiableList(job.results);
  }

  private WorkerPool startPool(ProcessingJob job) {
    if (!options.useWorkerThreads()) {
      return null;
    }
    PoolStart start = poolFactory.start(options.maxWorkers());
    if (!start.isStarted()) {
      log.warn(
          "Worker pool unavailable for job {}, processing sequentially: {}",
          job.id,
          start.failureReason());
      return null;
    }
    return start.pool();
  }

  private void notifyListener(String event, Consumer<ProcessingListener> notification) {
    try {
      notification.accept(listener);
    } catch (RuntimeException e) {
      log.warn("Listener failed on '{}' notification: {}", event, e.toString());
    }
  }
}
