package io.xmliterator.node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A mapping from element names to the values of the child elements. Keys
 * keep the order in which they first appeared in the document.
 * @since 1.0.0
 */
public final class MapNode extends Node {
  private final Map<String, Node> entries = new LinkedHashMap<>();

  /**
   * Add a child value under the given name. If the name is not yet present,
   * the value is stored directly (or as a single-element list if
   * <code>forceList</code> is set). If the name is present, the existing
   * value is promoted to a list and the new value is appended.
   * @param name the element name
   * @param value the value
   * @param forceList <code>true</code> if the value should be wrapped in a
   * list even if it is the first one with this name
   */
  public void append(String name, Node value, boolean forceList) {
    Node existing = entries.get(name);
    if (existing == null) {
      entries.put(name, forceList ? new ListNode(value) : value);
      return;
    }

    switch (existing.getType()) {
      case LIST:
        ((ListNode)existing).add(value);
        break;

      case NULL:
      case LEAF:
      case MAP:
        entries.put(name, new ListNode(existing, value));
        break;

      default:
        throw new IllegalStateException("Unknown node type: " + existing.getType());
    }
  }

  /**
   * Add a child value under the given name
   * @param name the element name
   * @param value the value
   * @see #append(String, Node, boolean)
   */
  public void append(String name, Node value) {
    append(name, value, false);
  }

  /**
   * @param name the element name
   * @return the value stored under the given name or <code>null</code> if
   * there is no such element (a present element without content is
   * {@link NullNode#INSTANCE})
   */
  public Node get(String name) {
    return entries.get(name);
  }

  /**
   * @return the element names in document order
   */
  public Set<String> keySet() {
    return Collections.unmodifiableSet(entries.keySet());
  }

  /**
   * @return the number of entries
   */
  public int size() {
    return entries.size();
  }

  /**
   * @return <code>true</code> if this mapping has no entries
   */
  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public Type getType() {
    return Type.MAP;
  }

  @Override
  public Object toObject() {
    Map<String, Object> result = new LinkedHashMap<>();
    for (Map.Entry<String, Node> e : entries.entrySet()) {
      result.put(e.getKey(), e.getValue().toObject());
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
    return entries.equals(((MapNode)o).entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }
}
