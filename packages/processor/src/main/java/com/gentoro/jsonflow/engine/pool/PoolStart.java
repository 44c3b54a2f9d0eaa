package com.gentoro.jsonflow.engine.pool;

import java.util.Objects;

/**
 * Outcome of trying to start a {@link WorkerPool}: either a running pool or the reason it could
 * not be started. Callers branch on {@link #isStarted()} instead of catching exceptions.
 */
public final class PoolStart {
  private final WorkerPool pool;
  private final String failureReason;
  private final Throwable cause;

  private PoolStart(WorkerPool pool, String failureReason, Throwable cause) {
    this.pool = pool;
    this.failureReason = failureReason;
    this.cause = cause;
  }

  public static PoolStart started(WorkerPool pool) {
    return new PoolStart(Objects.requireNonNull(pool, "pool"), null, null);
  }

  public static PoolStart failed(String reason, Throwable cause) {
    return new PoolStart(null, reason == null ? "unknown" : reason, cause);
  }

  public boolean isStarted() {
    return pool != null;
  }

  /** The running pool, or {@code null} when startup failed. */
  public WorkerPool pool() {
    return pool;
  }

  /** Why startup failed, or {@code null} when it succeeded. */
  public String failureReason() {
    return failureReason;
  }

  public Throwable cause() {
    return cause;
  }
}
