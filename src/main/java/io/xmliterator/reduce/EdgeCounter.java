package io.xmliterator.reduce;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

import io.xmliterator.input.XMLStreamEvent;

/**
 * Counts how often each element name occurs directly below each
 * parent element name
 * @since 1.0.0
 */
public class EdgeCounter implements XMLReducer<Map<Edge, Long>> {
  private final Deque<String> tagStack = new ArrayDeque<>();
  private final Map<Edge, Long> counts = new LinkedHashMap<>();

  @Override
  public void onEvent(XMLStreamEvent event) {
    switch (event.getKind()) {
      case START:
        count(event.getValue());
        tagStack.push(event.getValue());
        break;

      case EMPTY:
        count(event.getValue());
        break;

      case END:
        tagStack.poll();
        break;

      default:
        break;
    }
  }

  private void count(String child) {
    String parent = tagStack.peek();
    if (parent != null) {
      counts.merge(new Edge(parent, child), 1L, Long::sum);
    }
  }

  /**
   * @return the number of occurrences per edge, in the order in which the
   * edges were first seen
   */
  @Override
  public Map<Edge, Long> getResult() {
    return ImmutableMap.copyOf(counts);
  }
}
