package com.gentoro.jsonflow.tree;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NodeFlattenerTest {

  private final ObjectMapper mapper = new ObjectMapper();

  private static List<String> paths(List<WorkItem> items) {
    return items.stream().map(WorkItem::pathString).collect(Collectors.toList());
  }

  @Test
  @DisplayName("deep traversal emits root and every descendant in pre-order")
  void deepTraversalIsPreOrder() throws Exception {
    JsonNode root = mapper.readTree("{\"a\":1,\"b\":{\"c\":2}}");

    List<WorkItem> items = NodeFlattener.flatten(root, true);

    assertEquals(4, items.size());
    assertEquals(List.of("", "a", "b", "b.c"), paths(items));
    assertSame(root, items.get(0).value());
    assertEquals(2, items.get(3).value().asInt());
    assertEquals(2, items.get(3).depth());
  }

  @Test
  @DisplayName("shallow traversal emits only the root's direct children")
  void shallowTraversalStopsAtChildren() throws Exception {
    JsonNode root = mapper.readTree("{\"a\":1,\"b\":{\"c\":2}}");

    List<WorkItem> items = NodeFlattener.flatten(root, false);

    assertEquals(2, items.size());
    assertEquals(List.of("a", "b"), paths(items));
    assertTrue(items.get(1).value().isObject());
  }

  @Test
  @DisplayName("array children are visited in index order with index path segments")
  void arraysUseIndexSegments() throws Exception {
    JsonNode root = mapper.readTree("{\"users\":[{\"id\":1},{\"id\":2}]}");

    List<WorkItem> items = NodeFlattener.flatten(root, true);

    assertEquals(
        List.of("", "users", "users[0]", "users[0].id", "users[1]", "users[1].id"), paths(items));
    assertEquals(
        List.of(PathSegment.key("users"), PathSegment.index(1), PathSegment.key("id")),
        items.get(5).path());
  }

  @Test
  @DisplayName("indices are consecutive from zero")
  void indicesAreConsecutive() throws Exception {
    JsonNode root = mapper.readTree("[1,[2,3],{\"x\":[4]}]");

    List<WorkItem> items = NodeFlattener.flatten(root, true);

    for (int i = 0; i < items.size(); i++) {
      assertEquals(i, items.get(i).index());
    }
  }

  @Test
  @DisplayName("a scalar root yields exactly one item in both modes")
  void scalarRootYieldsOneItem() throws Exception {
    for (String json : List.of("42", "\"text\"", "true", "null")) {
      JsonNode root = mapper.readTree(json);
      assertEquals(1, NodeFlattener.flatten(root, true).size(), json);
      assertEquals(1, NodeFlattener.flatten(root, false).size(), json);
      assertEquals(0, NodeFlattener.flatten(root, false).get(0).depth());
    }
  }

  @Test
  @DisplayName("null root is treated as JSON null")
  void javaNullRoot() {
    List<WorkItem> items = NodeFlattener.flatten(null, true);

    assertEquals(1, items.size());
    assertTrue(items.get(0).value().isNull());
  }

  @Test
  @DisplayName("empty containers")
  void emptyContainers() throws Exception {
    JsonNode root = mapper.readTree("[]");

    assertEquals(1, NodeFlattener.flatten(root, true).size());
    assertTrue(NodeFlattener.flatten(root, false).isEmpty());
  }

  @Test
  @DisplayName("very deep nesting does not overflow the stack")
  void deepNesting() {
    ObjectNode root = mapper.createObjectNode();
    ObjectNode current = root;
    for (int i = 0; i < 5_000; i++) {
      current = current.putObject("level" + i);
    }

    List<WorkItem> items = NodeFlattener.flatten(root, true);

    assertEquals(5_001, items.size());
    assertEquals(5_000, items.get(items.size() - 1).depth());
  }

  @Test
  @DisplayName("flattening leaves the input untouched")
  void doesNotMutateInput() throws Exception {
    JsonNode root = mapper.readTree("{\"a\":[1,2,{\"b\":null}],\"c\":\"d\"}");
    JsonNode copy = root.deepCopy();

    NodeFlattener.flatten(root, true);
    NodeFlattener.flatten(root, false);

    assertEquals(copy, root);
  }
}
