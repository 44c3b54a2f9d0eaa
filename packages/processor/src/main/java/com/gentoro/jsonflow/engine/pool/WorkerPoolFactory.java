package com.gentoro.jsonflow.engine.pool;

/** Starts the worker pool of a job. Replaceable so callers can supply their own threads. */
@FunctionalInterface
public interface WorkerPoolFactory {

  WorkerPoolFactory DEFAULT = WorkerPool::start;

  PoolStart start(int workerCount);
}
