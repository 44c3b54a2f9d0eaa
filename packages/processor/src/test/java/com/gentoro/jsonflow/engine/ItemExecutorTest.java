package com.gentoro.jsonflow.engine;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.gentoro.jsonflow.tree.NodeFlattener;
import com.gentoro.jsonflow.tree.WorkItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ItemExecutorTest {

  private final ObjectMapper mapper = new ObjectMapper();

  private List<WorkItem> items(String json, boolean deep) throws Exception {
    return NodeFlattener.flatten(mapper.readTree(json), deep);
  }

  @Test
  @DisplayName("identity transform returns values unchanged without metadata")
  void identityByDefault() throws Exception {
    ItemExecutor executor = new ItemExecutor(null, 3, 0L);

    List<ProcessingResult> results = executor.executeAll(items("[1,2,3]", false));

    assertEquals(3, results.size());
    for (int i = 0; i < 3; i++) {
      ProcessingResult r = results.get(i);
      assertEquals(i, r.index());
      assertTrue(r.success());
      assertEquals(i + 1, r.value().asInt());
      assertNull(r.error());
      assertNull(r.metadata());
    }
  }

  @Test
  @DisplayName("context carries index, total, depth and path")
  void contextIsPopulated() throws Exception {
    List<ProcessingContext> seen = new ArrayList<>();
    ItemExecutor executor =
        new ItemExecutor(
            (value, ctx) -> {
              seen.add(ctx);
              return TransformResult.success(value);
            },
            4,
            1234L);

    executor.executeAll(items("{\"a\":1,\"b\":{\"c\":2}}", true));

    assertEquals(4, seen.size());
    ProcessingContext last = seen.get(3);
    assertEquals(3, last.index());
    assertEquals(4, last.total());
    assertEquals(2, last.depth());
    assertEquals("b.c", last.pathString());
    assertEquals(1234L, last.startTimeMillis());
  }

  @Test
  @DisplayName("a throwing transform fails only its own item")
  void failureIsContained() throws Exception {
    ItemExecutor executor =
        new ItemExecutor(
            (value, ctx) -> {
              if (ctx.index() == 2) {
                throw new IllegalStateException("Processing error");
              }
              return TransformResult.success(IntNode.valueOf(value.asInt() * 10));
            },
            5,
            0L);

    List<ProcessingResult> results = executor.executeAll(items("[1,2,3,4,5]", false));

    assertEquals(5, results.size());
    ProcessingResult failed = results.get(2);
    assertFalse(failed.success());
    assertNull(failed.value());
    assertEquals("Processing error", failed.error());
    assertNull(failed.metadata());
    assertEquals(40, results.get(3).value().asInt());
    assertEquals(4, results.stream().filter(ProcessingResult::success).count());
  }

  @Test
  @DisplayName("checked exceptions and blank messages are recorded")
  void checkedExceptionWithoutMessage() throws Exception {
    ItemExecutor executor =
        new ItemExecutor(
            (value, ctx) -> {
              throw new java.io.IOException();
            },
            1,
            0L);

    ProcessingResult r = executor.execute(items("7", true).get(0));

    assertFalse(r.success());
    assertEquals("IOException", r.error());
  }

  @Test
  @DisplayName("a transform returning null is an item failure")
  void nullResultFails() throws Exception {
    ItemExecutor executor = new ItemExecutor((value, ctx) -> null, 1, 0L);

    ProcessingResult r = executor.execute(items("7", true).get(0));

    assertFalse(r.success());
    assertEquals(ItemExecutor.NO_RESULT, r.error());
  }

  @Test
  @DisplayName("reported failures pass through unchanged")
  void reportedFailure() throws Exception {
    ItemExecutor executor =
        new ItemExecutor((value, ctx) -> TransformResult.failure("rejected"), 1, 0L);

    ProcessingResult r = executor.execute(items("7", true).get(0));

    assertFalse(r.success());
    assertEquals("rejected", r.error());
  }

  @Test
  @DisplayName("annotating transform adds index, depth and path metadata")
  void annotatingTransform() throws Exception {
    ItemExecutor executor = new ItemExecutor(ItemTransform.ANNOTATING, 3, 0L);

    List<ProcessingResult> results = executor.executeAll(items("{\"users\":[5]}", true));

    Map<String, Object> meta = results.get(2).metadata();
    assertEquals(2, meta.get("index"));
    assertEquals(2, meta.get("depth"));
    assertEquals("users[0]", meta.get("path"));
    assertEquals(5, results.get(2).value().asInt());
  }

  @Test
  @DisplayName("transforms resolve by configuration name")
  void namedTransforms() {
    assertSame(ItemTransform.IDENTITY, ItemTransform.named(null));
    assertSame(ItemTransform.IDENTITY, ItemTransform.named(" Identity "));
    assertSame(ItemTransform.ANNOTATING, ItemTransform.named("annotate"));
    assertThrows(IllegalArgumentException.class, () -> ItemTransform.named("uppercase"));
  }

  @Test
  @DisplayName("metadata returned by a transform cannot be modified afterwards")
  void metadataIsCopied() throws Exception {
    Map<String, Object> mutable = new java.util.HashMap<>();
    mutable.put("k", "v");
    JsonNode value = IntNode.valueOf(1);
    TransformResult result = TransformResult.success(value, mutable);
    mutable.put("k", "changed");

    assertEquals("v", result.metadata().get("k"));
    assertThrows(UnsupportedOperationException.class, () -> result.metadata().put("x", 1));
  }
}
