package io.xmliterator.reduce;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

import io.xmliterator.ConfigConstants;
import io.xmliterator.ParserOptions;
import io.xmliterator.input.XMLStreamEvent;
import io.xmliterator.node.LeafNode;
import io.xmliterator.node.MapNode;
import io.xmliterator.node.Node;
import io.xmliterator.node.NullNode;

/**
 * Builds a tree of {@link Node}s from XML events the same way xmltodict
 * converts a document to a dictionary:
 * <ul>
 * <li>An element with child elements becomes a mapping. Text directly inside
 * such an element is dropped.</li>
 * <li>An element with text only becomes a leaf. Leading and trailing
 * whitespace is removed, whitespace inside the text is kept.</li>
 * <li>An element without text (or with whitespace only) and a self-closing
 * element become {@link NullNode null}.</li>
 * <li>If an element name occurs more than once below the same parent, the
 * values are collected in a list.</li>
 * </ul>
 * Attributes are not read.
 * @since 1.0.0
 */
public class DictReducer implements XMLReducer<Node> {
  /**
   * An element that has been opened but not closed yet
   */
  private static class Context {
    final String name;
    final MapNode children = new MapNode();
    final StringBuilder text = new StringBuilder();

    Context(String name) {
      this.name = name;
    }
  }

  private final Deque<Context> stack = new ArrayDeque<>();
  private final MapNode root = new MapNode();
  private final int maxDepth;
  private final Set<String> forceList;

  /**
   * The nesting level inside an element that is deeper than
   * {@link #maxDepth} (0 if no element is being skipped)
   */
  private int skipped = 0;

  /**
   * Create a reducer with default options
   */
  public DictReducer() {
    this(new ParserOptions());
  }

  /**
   * Create a reducer
   * @param options options providing the maximum depth and the names of
   * elements that should always be wrapped in a list
   */
  public DictReducer(ParserOptions options) {
    this.maxDepth = options.getMaxDepth();
    this.forceList = options.getForceList();
  }

  @Override
  public void onEvent(XMLStreamEvent event) {
    switch (event.getKind()) {
      case START:
        if (skipped > 0 || tooDeep()) {
          skipped++;
        } else {
          stack.push(new Context(event.getValue()));
        }
        break;

      case END:
        if (skipped > 0) {
          skipped--;
        } else if (!stack.isEmpty()) {
          Context c = stack.pop();
          attach(c.name, finish(c));
        }
        break;

      case EMPTY:
        if (skipped == 0 && !tooDeep()) {
          attach(event.getValue(), NullNode.INSTANCE);
        }
        break;

      case TEXT:
        if (skipped == 0 && !stack.isEmpty()) {
          Context c = stack.peek();
          // text next to child elements is dropped anyhow
          if (c.children.isEmpty()) {
            c.text.append(event.getValue());
          }
        }
        break;

      default:
        break;
    }
  }

  /**
   * @return <code>true</code> if a new element at the current position
   * would be nested deeper than {@link #maxDepth}
   */
  private boolean tooDeep() {
    return maxDepth != ConfigConstants.UNLIMITED && stack.size() >= maxDepth;
  }

  private void attach(String name, Node value) {
    if (stack.isEmpty()) {
      root.append(name, value, forceList.contains(name));
    } else {
      Context parent = stack.peek();
      parent.children.append(name, value, forceList.contains(name));
      parent.text.setLength(0);
    }
  }

  private static Node finish(Context c) {
    if (!c.children.isEmpty()) {
      return c.children;
    }
    String text = c.text.toString().strip();
    if (text.isEmpty()) {
      return NullNode.INSTANCE;
    }
    return new LeafNode(text);
  }

  /**
   * Get the tree built so far. Elements that are still open (because the
   * stream was cut short) are closed and attached to their parents.
   * @return a mapping from the root element's name to its value, or an
   * empty mapping if no element has been seen
   */
  @Override
  public Node getResult() {
    skipped = 0;
    while (!stack.isEmpty()) {
      Context c = stack.pop();
      attach(c.name, finish(c));
    }
    return root;
  }
}
