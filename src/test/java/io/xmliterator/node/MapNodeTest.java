package io.xmliterator.node;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import java.util.Arrays;

import org.junit.Test;

/**
 * Test {@link MapNode}
 */
public class MapNodeTest {
  /**
   * A repeated name promotes the existing value to a list
   */
  @Test
  public void promote() {
    MapNode m = new MapNode();
    m.append("a", new LeafNode("1"));
    assertEquals(Node.Type.LEAF, m.get("a").getType());

    m.append("a", NullNode.INSTANCE);
    assertEquals(new ListNode(new LeafNode("1"), NullNode.INSTANCE), m.get("a"));

    MapNode child = new MapNode();
    child.append("x", new LeafNode("y"));
    m.append("a", child);
    ListNode list = (ListNode)m.get("a");
    assertEquals(3, list.size());
    assertSame(child, list.get(2));
  }

  /**
   * A mapping value is promoted like any other value
   */
  @Test
  public void promoteMap() {
    MapNode m = new MapNode();
    MapNode first = new MapNode();
    first.append("c", new LeafNode("1"));
    m.append("b", first);
    m.append("b", new LeafNode("2"));
    assertEquals("{\"b\":[{\"c\":\"1\"},\"2\"]}", m.toJson());
  }

  /**
   * Forced lists wrap the first value
   */
  @Test
  public void forceList() {
    MapNode m = new MapNode();
    m.append("a", new LeafNode("1"), true);
    assertEquals("{\"a\":[\"1\"]}", m.toJson());
    m.append("a", new LeafNode("2"), true);
    assertEquals("{\"a\":[\"1\",\"2\"]}", m.toJson());
  }

  /**
   * Keys keep their insertion order and nulls are encoded
   */
  @Test
  public void toJson() {
    MapNode m = new MapNode();
    m.append("z", NullNode.INSTANCE);
    m.append("a", new LeafNode("\"quoted\""));
    m.append("m", new ListNode());
    assertEquals(Arrays.asList("z", "a", "m"), Arrays.asList(m.keySet().toArray()));
    assertEquals("{\"z\":null,\"a\":\"\\\"quoted\\\"\",\"m\":[]}", m.toJson());
    assertEquals(m.toJson(), m.toString());
    assertNull(m.get("missing"));
  }
}
