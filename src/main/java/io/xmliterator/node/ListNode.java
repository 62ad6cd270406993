package io.xmliterator.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The values of sibling elements sharing the same name, in document order
 * @since 1.0.0
 */
public final class ListNode extends Node {
  private final List<Node> items = new ArrayList<>();

  /**
   * Create a new list
   * @param items the initial items
   */
  public ListNode(Node... items) {
    Collections.addAll(this.items, items);
  }

  /**
   * Append an item
   * @param item the item
   */
  public void add(Node item) {
    items.add(item);
  }

  /**
   * @param index the item's index
   * @return the item
   */
  public Node get(int index) {
    return items.get(index);
  }

  /**
   * @return the number of items
   */
  public int size() {
    return items.size();
  }

  /**
   * @return an unmodifiable view of the items
   */
  public List<Node> getItems() {
    return Collections.unmodifiableList(items);
  }

  @Override
  public Type getType() {
    return Type.LIST;
  }

  @Override
  public Object toObject() {
    List<Object> result = new ArrayList<>(items.size());
    for (Node item : items) {
      result.add(item.toObject());
    }
    return result;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return items.equals(((ListNode)o).items);
  }

  @Override
  public int hashCode() {
    return items.hashCode();
  }
}
