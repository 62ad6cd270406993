package io.xmliterator.reduce;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import io.xmliterator.MalformedXMLException;
import io.xmliterator.input.EventKind;
import io.xmliterator.input.XMLStreamEvent;
import io.xmliterator.node.Node;

/**
 * Test {@link Reductions}
 */
public class ReductionsTest {
  /**
   * Emits the given events and then fails
   */
  private static class FailingIterator implements Iterator<XMLStreamEvent> {
    private final Iterator<XMLStreamEvent> delegate;
    private final MalformedXMLException failure;

    FailingIterator(List<XMLStreamEvent> events, MalformedXMLException failure) {
      this.delegate = events.iterator();
      this.failure = failure;
    }

    @Override
    public boolean hasNext() {
      if (!delegate.hasNext()) {
        throw failure;
      }
      return true;
    }

    @Override
    public XMLStreamEvent next() {
      hasNext();
      return delegate.next();
    }
  }

  private static List<XMLStreamEvent> events() {
    return Arrays.asList(
        new XMLStreamEvent(0, EventKind.START, "a", 0),
        new XMLStreamEvent(1, EventKind.EMPTY, "b", 3),
        new XMLStreamEvent(2, EventKind.START, "c", 7),
        new XMLStreamEvent(3, EventKind.TEXT, "x", 10));
  }

  /**
   * A failing stream yields the partial result and the failure
   */
  @Test
  public void failure() {
    MalformedXMLException failure = new MalformedXMLException("broken", 11, null);
    ReductionResult<Map<Edge, Long>> counts = Reductions.reduce(
        new FailingIterator(events(), failure), new EdgeCounter());
    assertSame(failure, counts.getError().get());
    assertEquals(4, counts.getEventsConsumed());
    assertFalse(counts.isLimitReached());
    assertFalse(counts.isComplete());
    assertEquals(Long.valueOf(1), counts.getValue().get(new Edge("a", "b")));
    assertEquals(Long.valueOf(1), counts.getValue().get(new Edge("a", "c")));

    ReductionResult<Node> tree = Reductions.reduce(
        new FailingIterator(events(), failure), new DictReducer());
    assertEquals("{\"a\":{\"b\":null,\"c\":\"x\"}}", tree.getValue().toJson());
  }

  /**
   * A complete stream yields a complete result
   */
  @Test
  public void complete() {
    List<XMLStreamEvent> events = Arrays.asList(
        new XMLStreamEvent(0, EventKind.START, "a", 0),
        new XMLStreamEvent(1, EventKind.END, "a", 3));
    ReductionResult<Node> r = Reductions.reduce(
        events.iterator(), new DictReducer());
    assertTrue(r.isComplete());
    assertEquals(2, r.getEventsConsumed());
    assertEquals("{\"a\":null}", r.getValue().toJson());
  }

  /**
   * A limit of zero consumes nothing
   */
  @Test
  public void zeroLimit() {
    ReductionResult<Node> r = Reductions.reduce(
        events().iterator(), new DictReducer(), 0);
    assertTrue(r.isLimitReached());
    assertEquals(0, r.getEventsConsumed());
    assertEquals("{}", r.getValue().toJson());
  }

  /**
   * A limit that equals the number of events reports the limit as reached
   */
  @Test
  public void exactLimit() {
    ReductionResult<Node> r = Reductions.reduce(
        events().iterator(), new DictReducer(), 4);
    assertTrue(r.isLimitReached());
    assertEquals(4, r.getEventsConsumed());
  }
}
