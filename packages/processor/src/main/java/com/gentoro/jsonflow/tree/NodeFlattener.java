package com.gentoro.jsonflow.tree;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Turns a JSON tree into the ordered list of {@link WorkItem}s a job processes.
 *
 * <p>Deep mode visits nodes depth-first in pre-order: a container is emitted before its children,
 * array elements in index order and object fields in insertion order. For {@code {"a":1,"b":{"c":2}}}
 * the order is root, {@code a}, {@code b}, {@code b.c}.
 *
 * <p>Shallow mode emits only the direct children of a container root. A scalar root yields one
 * item in both modes.
 *
 * <p>Traversal uses an explicit stack, so nesting depth is bounded by heap rather than by the
 * thread stack.
 */
public final class NodeFlattener {

  private record Frame(JsonNode node, List<PathSegment> path) {}

  private NodeFlattener() {}

  public static List<WorkItem> flatten(JsonNode root, boolean deep) {
    JsonNode start = root == null ? NullNode.getInstance() : root;
    return deep ? flattenDeep(start) : flattenShallow(start);
  }

  private static List<WorkItem> flattenShallow(JsonNode root) {
    List<WorkItem> items = new ArrayList<>();
    if (!root.isContainerNode()) {
      items.add(new WorkItem(0, root, List.of()));
      return items;
    }
    for (Frame child : children(root, List.of())) {
      items.add(new WorkItem(items.size(), child.node(), child.path()));
    }
    return items;
  }

  private static List<WorkItem> flattenDeep(JsonNode root) {
    List<WorkItem> items = new ArrayList<>();
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(root, List.of()));

    while (!stack.isEmpty()) {
      Frame frame = stack.pop();
      items.add(new WorkItem(items.size(), frame.node(), frame.path()));

      if (frame.node().isContainerNode()) {
        List<Frame> children = children(frame.node(), frame.path());
        // reversed so the first child is popped first
        for (int i = children.size() - 1; i >= 0; i--) {
          stack.push(children.get(i));
        }
      }
    }
    return items;
  }

  private static List<Frame> children(JsonNode container, List<PathSegment> parentPath) {
    List<Frame> children = new ArrayList<>(container.size());
    if (container.isArray()) {
      for (int i = 0; i < container.size(); i++) {
        children.add(new Frame(container.get(i), append(parentPath, PathSegment.index(i))));
      }
    } else if (container.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = container.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        children.add(
            new Frame(field.getValue(), append(parentPath, PathSegment.key(field.getKey()))));
      }
    }
    return children;
  }

  private static List<PathSegment> append(List<PathSegment> path, PathSegment segment) {
    List<PathSegment> extended = new ArrayList<>(path.size() + 1);
    extended.addAll(path);
    extended.add(segment);
    return extended;
  }
}
