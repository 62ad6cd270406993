package io.xmliterator.node;

import io.vertx.core.json.Json;

/**
 * A value in the tree built from an XML document. A node is either
 * {@link NullNode null}, a {@link LeafNode leaf} string, an ordered
 * {@link ListNode list} of nodes (repeated sibling elements) or a
 * {@link MapNode mapping} from element names to nodes.
 * @since 1.0.0
 */
public abstract class Node {
  /**
   * The four cases a node can have
   */
  public enum Type {
    NULL,
    LEAF,
    LIST,
    MAP
  }

  /**
   * @return the case of this node
   */
  public abstract Type getType();

  /**
   * Convert this node to plain Java objects: <code>null</code>, a
   * {@link String}, a {@link java.util.List} or a {@link java.util.Map}
   * (with keys in document order)
   * @return the converted node
   */
  public abstract Object toObject();

  /**
   * @return this node encoded as a JSON string
   */
  public String toJson() {
    return Json.encode(toObject());
  }

  @Override
  public String toString() {
    return toJson();
  }
}
