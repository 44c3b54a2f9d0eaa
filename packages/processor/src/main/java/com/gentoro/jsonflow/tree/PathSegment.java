package com.gentoro.jsonflow.tree;

import java.util.List;
import java.util.Objects;

/** One step from a container to one of its children: an object key or an array index. */
public final class PathSegment {
  private final String key;
  private final int index;

  private PathSegment(String key, int index) {
    this.key = key;
    this.index = index;
  }

  public static PathSegment key(String key) {
    return new PathSegment(Objects.requireNonNull(key, "key"), -1);
  }

  public static PathSegment index(int index) {
    if (index < 0) {
      throw new IllegalArgumentException("Array index must be non-negative: " + index);
    }
    return new PathSegment(null, index);
  }

  public boolean isIndex() {
    return key == null;
  }

  /** Object key, or {@code null} for an array index segment. */
  public String getKey() {
    return key;
  }

  /** Array index, or {@code -1} for an object key segment. */
  public int getIndex() {
    return index;
  }

  /**
   * Render a path in dotted form, e.g. {@code users[0].name}. The root (empty path) renders as the
   * empty string.
   */
  public static String render(List<PathSegment> path) {
    StringBuilder sb = new StringBuilder();
    for (PathSegment segment : path) {
      if (segment.isIndex()) {
        sb.append('[').append(segment.index).append(']');
      } else {
        if (sb.length() > 0) sb.append('.');
        sb.append(segment.key);
      }
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PathSegment other)) return false;
    return index == other.index && Objects.equals(key, other.key);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, index);
  }

  @Override
  public String toString() {
    return isIndex() ? "[" + index + "]" : key;
  }
}
