package io.xmliterator.input;

import java.util.Objects;

/**
 * An event produced by {@link EventNormalizer}. Events are immutable and are
 * not retained by the normalizer after they have been handed out.
 * @since 1.0.0
 */
public class XMLStreamEvent {
  private final long index;
  private final EventKind kind;
  private final String value;
  private final long pos;

  /**
   * Constructs a new event
   * @param index the index of the event in the stream (starting at 0)
   * @param kind the event kind
   * @param value the element name or, for {@link EventKind#TEXT}, the text
   * @param pos the position in the XML stream where the event has occurred
   */
  public XMLStreamEvent(long index, EventKind kind, String value, long pos) {
    this.index = index;
    this.kind = Objects.requireNonNull(kind);
    this.value = Objects.requireNonNull(value);
    this.pos = pos;
  }

  /**
   * @return the index of the event in the stream. Indexes start at 0 and
   * increase by one for every event.
   */
  public long getIndex() {
    return index;
  }

  /**
   * @return the event kind
   */
  public EventKind getKind() {
    return kind;
  }

  /**
   * @return the element name or, for {@link EventKind#TEXT}, the text
   */
  public String getValue() {
    return value;
  }

  /**
   * @return the position in the XML stream where the event has occurred.
   * Not part of {@link #equals(Object)}.
   */
  public long getPos() {
    return pos;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    XMLStreamEvent that = (XMLStreamEvent)o;
    return index == that.index &&
      kind == that.kind &&
      value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(index, kind, value);
  }

  @Override
  public String toString() {
    return "(" + index + ", " + kind + ", " + value + ")";
  }
}
