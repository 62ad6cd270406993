package io.xmliterator.node;

import java.util.Objects;

/**
 * An element that only contains text
 */
public final class LeafNode extends Node {
  private final String value;

  /**
   * Create a new leaf
   * @param value the text
   */
  public LeafNode(String value) {
    this.value = Objects.requireNonNull(value);
  }

  /**
   * @return the text
   */
  public String getValue() {
    return value;
  }

  @Override
  public Type getType() {
    return Type.LEAF;
  }

  @Override
  public Object toObject() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return value.equals(((LeafNode)o).value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }
}
