package com.gentoro.jsonflow.jobs;

import com.gentoro.jsonflow.engine.ItemTransform;
import com.gentoro.jsonflow.exception.ConfigurationException;
import com.gentoro.jsonflow.exception.InvalidOptionsException;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;

/**
 * Immutable settings of a processing job. Instances are validated when built, so an invalid value
 * is reported before any batch runs.
 *
 * <p>Configuration keys read by {@link #fromConfiguration(Configuration)}:
 *
 * <ul>
 *   <li>{@code processing.batch-size}
 *   <li>{@code processing.batch-delay-ms}
 *   <li>{@code processing.deep}
 *   <li>{@code processing.partial-results}
 *   <li>{@code processing.worker-threads}
 *   <li>{@code processing.max-workers}
 *   <li>{@code processing.transform} ({@code identity} or {@code annotate})
 * </ul>
 */
public final class ProcessingOptions {
  public static final int DEFAULT_BATCH_SIZE = 1000;

  private final int batchSize;
  private final long batchDelayMs;
  private final boolean enableDeepProcessing;
  private final boolean enablePartialResults;
  private final boolean useWorkerThreads;
  private final int maxWorkers;
  private final ItemTransform transform;

  private ProcessingOptions(Builder b) {
    this.batchSize = b.batchSize;
    this.batchDelayMs = b.batchDelayMs;
    this.enableDeepProcessing = b.enableDeepProcessing;
    this.enablePartialResults = b.enablePartialResults;
    this.useWorkerThreads = b.useWorkerThreads;
    this.maxWorkers = b.maxWorkers;
    this.transform = b.transform;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ProcessingOptions defaults() {
    return builder().build();
  }

  public static ProcessingOptions fromConfiguration(Configuration config) {
    Builder b = builder();
    try {
      b.batchSize(config.getInt("processing.batch-size", DEFAULT_BATCH_SIZE))
          .batchDelayMs(config.getLong("processing.batch-delay-ms", 0L))
          .enableDeepProcessing(config.getBoolean("processing.deep", true))
          .enablePartialResults(config.getBoolean("processing.partial-results", false))
          .useWorkerThreads(config.getBoolean("processing.worker-threads", false))
          .maxWorkers(config.getInt("processing.max-workers", defaultMaxWorkers()));
    } catch (ConversionException e) {
      throw new ConfigurationException("Invalid processing configuration: " + e.getMessage(), e);
    }
    try {
      b.transform(ItemTransform.named(config.getString("processing.transform", "identity")));
    } catch (IllegalArgumentException e) {
      throw new InvalidOptionsException(e.getMessage());
    }
    return b.build();
  }

  static int defaultMaxWorkers() {
    return Math.max(1, Runtime.getRuntime().availableProcessors());
  }

  public int batchSize() {
    return batchSize;
  }

  public long batchDelayMs() {
    return batchDelayMs;
  }

  public boolean enableDeepProcessing() {
    return enableDeepProcessing;
  }

  public boolean enablePartialResults() {
    return enablePartialResults;
  }

  /**
   * Whether batches are fanned out to worker threads. When set, the transform is called from
   * several threads at once and must not depend on shared mutable state.
   */
  public boolean useWorkerThreads() {
    return useWorkerThreads;
  }

  public int maxWorkers() {
    return maxWorkers;
  }

  public ItemTransform transform() {
    return transform;
  }

  public Builder toBuilder() {
    return new Builder()
        .batchSize(batchSize)
        .batchDelayMs(batchDelayMs)
        .enableDeepProcessing(enableDeepProcessing)
        .enablePartialResults(enablePartialResults)
        .useWorkerThreads(useWorkerThreads)
        .maxWorkers(maxWorkers)
        .transform(transform);
  }

  @Override
  public String toString() {
    return "ProcessingOptions{batchSize=%d, batchDelayMs=%d, deep=%s, partialResults=%s, workerThreads=%s, maxWorkers=%d}"
        .formatted(
            batchSize,
            batchDelayMs,
            enableDeepProcessing,
            enablePartialResults,
            useWorkerThreads,
            maxWorkers);
  }

  public static final class Builder {
    private int batchSize = DEFAULT_BATCH_SIZE;
    private long batchDelayMs = 0L;
    private boolean enableDeepProcessing = true;
    private boolean enablePartialResults = false;
    private boolean useWorkerThreads = false;
    private int maxWorkers = defaultMaxWorkers();
    private ItemTransform transform = ItemTransform.IDENTITY;

    private Builder() {}

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder batchDelayMs(long batchDelayMs) {
      this.batchDelayMs = batchDelayMs;
      return this;
    }

    public Builder enableDeepProcessing(boolean enableDeepProcessing) {
      this.enableDeepProcessing = enableDeepProcessing;
      return this;
    }

    public Builder enablePartialResults(boolean enablePartialResults) {
      this.enablePartialResults = enablePartialResults;
      return this;
    }

    public Builder useWorkerThreads(boolean useWorkerThreads) {
      this.useWorkerThreads = useWorkerThreads;
      return this;
    }

    public Builder maxWorkers(int maxWorkers) {
      this.maxWorkers = maxWorkers;
      return this;
    }

    /** {@code null} selects {@link ItemTransform#IDENTITY}. */
    public Builder transform(ItemTransform transform) {
      this.transform = transform == null ? ItemTransform.IDENTITY : transform;
      return this;
    }

    public ProcessingOptions build() {
      if (batchSize <= 0) {
        throw new InvalidOptionsException("batchSize must be positive, was " + batchSize);
      }
      if (batchDelayMs < 0) {
        throw new InvalidOptionsException("batchDelayMs must not be negative, was " + batchDelayMs);
      }
      if (maxWorkers <= 0) {
        throw new InvalidOptionsException("maxWorkers must be positive, was " + maxWorkers);
      }
      return new ProcessingOptions(this);
    }
  }
}
