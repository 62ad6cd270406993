package io.xmliterator.reduce;

import java.util.Objects;

/**
 * A parent/child pair of element names
 * @since 1.0.0
 */
public final class Edge {
  private final String parent;
  private final String child;

  /**
   * Create a new edge
   * @param parent the name of the parent element
   * @param child the name of the child element
   */
  public Edge(String parent, String child) {
    this.parent = Objects.requireNonNull(parent);
    this.child = Objects.requireNonNull(child);
  }

  /**
   * @return the name of the parent element
   */
  public String getParent() {
    return parent;
  }

  /**
   * @return the name of the child element
   */
  public String getChild() {
    return child;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Edge that = (Edge)o;
    return parent.equals(that.parent) && child.equals(that.child);
  }

  @Override
  public int hashCode() {
    return Objects.hash(parent, child);
  }

  @Override
  public String toString() {
    return "(" + parent + ", " + child + ")";
  }
}
