package io.xmliterator.input;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

import io.vertx.core.logging.Logger;
import io.vertx.core.logging.LoggerFactory;
import io.xmliterator.MismatchedTagException;
import io.xmliterator.XMLIteratorException;

/**
 * Turns the tokens of an {@link XMLTokenizer} into a lazy, forward-only
 * sequence of indexed {@link XMLStreamEvent}s.
 *
 * <p>Adjacent text tokens are coalesced into a single {@link EventKind#TEXT}
 * event. Text is not trimmed. Text outside the root element is dropped.
 * A self-closing element is reported as one {@link EventKind#EMPTY} event and
 * does not touch the tag stack.</p>
 *
 * <p>The normalizer reads at most one token ahead and does not keep events
 * after they have been returned. Memory usage is bounded by the current
 * nesting depth and the length of the current text run.</p>
 *
 * <p>If the input is malformed, the normalizer returns all events up to the
 * point of failure, then throws the failure from {@link #hasNext()} and
 * ends. The underlying input is closed as soon as the stream has ended,
 * has failed or {@link #close()} has been called.</p>
 * @since 1.0.0
 */
public class EventNormalizer implements Iterator<XMLStreamEvent>, Closeable {
  private static final Logger log = LoggerFactory.getLogger(EventNormalizer.class);

  private static final int MAX_RETAINED_TEXT_CAPACITY = 8192;

  private final XMLTokenizer tokenizer;

  /**
   * Names of the currently open elements
   */
  private final Deque<String> tagStack = new ArrayDeque<>();

  /**
   * The current text run
   */
  private final StringBuilder text = new StringBuilder();
  private long textPos = -1;

  /**
   * A token that has been read to terminate a text run but not processed yet
   */
  private XMLToken pendingToken;

  /**
   * A failure that occurred while a text run was pending. It will be thrown
   * after the text event has been returned.
   */
  private XMLIteratorException pendingFailure;

  private XMLStreamEvent nextEvent;
  private long index = 0;
  private boolean finished = false;
  private boolean closed = false;

  /**
   * Create a new normalizer
   * @param tokenizer the tokenizer providing raw tokens. It will be closed
   * when this normalizer is closed.
   */
  public EventNormalizer(XMLTokenizer tokenizer) {
    this.tokenizer = tokenizer;
  }

  /**
   * Try to produce the next event
   * @return <code>true</code> if there is another event, <code>false</code>
   * if the end of the document has been reached
   * @throws XMLIteratorException if the input is malformed or cannot
   * be decoded
   */
  @Override
  public boolean hasNext() {
    if (nextEvent != null) {
      return true;
    }
    if (finished) {
      return false;
    }
    nextEvent = advance();
    return nextEvent != null;
  }

  @Override
  public XMLStreamEvent next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    XMLStreamEvent result = nextEvent;
    nextEvent = null;
    return result;
  }

  /**
   * @return the number of events produced so far
   */
  public long getEventCount() {
    return index;
  }

  /**
   * @return the number of currently open elements
   */
  public int getDepth() {
    return tagStack.size();
  }

  private XMLStreamEvent advance() {
    if (pendingFailure != null) {
      XMLIteratorException f = pendingFailure;
      pendingFailure = null;
      throw fail(f);
    }

    while (true) {
      XMLToken token = pendingToken;
      pendingToken = null;
      if (token == null) {
        try {
          token = tokenizer.hasNext() ? tokenizer.next() : null;
        } catch (XMLIteratorException e) {
          if (text.length() > 0) {
            pendingFailure = e;
            return makeTextEvent();
          }
          throw fail(e);
        }
      }

      if (token == null) {
        if (text.length() > 0) {
          return makeTextEvent();
        }
        if (!tagStack.isEmpty()) {
          log.debug("Document ended with " + tagStack.size() + " open elements");
        }
        finish();
        return null;
      }

      if (token.getType() == XMLToken.Type.TEXT) {
        if (!tagStack.isEmpty()) {
          if (text.length() == 0) {
            textPos = token.getPos();
          }
          text.append(token.getValue());
        }
        continue;
      }

      if (text.length() > 0) {
        pendingToken = token;
        return makeTextEvent();
      }

      String name = token.getValue();
      switch (token.getType()) {
        case START_ELEMENT:
          tagStack.push(name);
          return makeEvent(EventKind.START, name, token.getPos());

        case EMPTY_ELEMENT:
          return makeEvent(EventKind.EMPTY, name, token.getPos());

        case END_ELEMENT:
          String open = tagStack.peek();
          if (!name.equals(open)) {
            throw fail(new MismatchedTagException(open, name, token.getPos()));
          }
          tagStack.pop();
          return makeEvent(EventKind.END, name, token.getPos());

        default:
          throw new IllegalStateException("Unknown token type: " + token.getType());
      }
    }
  }

  private XMLStreamEvent makeTextEvent() {
    XMLStreamEvent e = makeEvent(EventKind.TEXT, text.toString(), textPos);
    text.setLength(0);
    if (text.capacity() > MAX_RETAINED_TEXT_CAPACITY) {
      // release the memory of a long text run
      text.trimToSize();
    }
    textPos = -1;
    return e;
  }

  private XMLStreamEvent makeEvent(EventKind kind, String value, long pos) {
    return new XMLStreamEvent(index++, kind, value, pos);
  }

  /**
   * End the stream because of the given failure
   * @param e the failure
   * @return the failure so it can be thrown
   */
  private XMLIteratorException fail(XMLIteratorException e) {
    try {
      finish();
    } catch (UncheckedIOException ce) {
      e.addSuppressed(ce);
    }
    return e;
  }

  private void finish() {
    finished = true;
    try {
      close();
    } catch (IOException e) {
      throw new UncheckedIOException("Could not close input", e);
    }
  }

  /**
   * Stop producing events and release the underlying input. Calling this
   * method more than once has no effect.
   * @throws IOException if the input could not be closed
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    finished = true;
    nextEvent = null;
    pendingToken = null;
    tokenizer.close();
  }
}
