package com.gentoro.jsonflow.engine;

import com.gentoro.jsonflow.exception.ExceptionUtil;
import com.gentoro.jsonflow.logging.LoggingService;
import com.gentoro.jsonflow.tree.WorkItem;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;

/**
 * Applies the job's transform to work items. A failing transform produces a failed {@link
 * ProcessingResult} for that item only; nothing thrown by the transform leaves this class.
 *
 * <p>Stateless apart from its constructor arguments, so one instance can be shared by worker
 * threads.
 */
public final class ItemExecutor {
  private static final Logger log = LoggingService.getLogger(ItemExecutor.class);

  static final String NO_RESULT = "Transform returned no result";

  private final ItemTransform transform;
  private final int total;
  private final long startTimeMillis;

  public ItemExecutor(ItemTransform transform, int total, long startTimeMillis) {
    this.transform = transform == null ? ItemTransform.IDENTITY : transform;
    this.total = total;
    this.startTimeMillis = startTimeMillis;
  }

  public ProcessingResult execute(WorkItem item) {
    ProcessingContext context =
        new ProcessingContext(item.index(), total, item.depth(), item.path(), startTimeMillis);
    try {
      TransformResult result = transform.apply(item.value(), context);
      if (result == null) {
        return ProcessingResult.failed(item.index(), NO_RESULT);
      }
      return ProcessingResult.of(item.index(), result);
    } catch (Exception e) {
      if (log.isDebugEnabled()) {
        log.debug(
            "Transform failed for item {} at '{}': {} [{}]",
            item.index(),
            item.pathString(),
            e.toString(),
            ExceptionUtil.formatCompactStackTrace(e));
      }
      return ProcessingResult.failed(item.index(), ExceptionUtil.messageOf(e));
    }
  }

  /** Run every item of {@code batch} on the calling thread, in order. */
  public List<ProcessingResult> executeAll(List<WorkItem> batch) {
    List<ProcessingResult> results = new ArrayList<>(batch.size());
    for (WorkItem item : batch) {
      results.add(execute(item));
    }
    return results;
  }
}
