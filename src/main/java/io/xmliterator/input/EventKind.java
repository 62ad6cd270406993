package io.xmliterator.input;

/**
 * The four canonical kinds of {@link XMLStreamEvent}s
 * @since 1.0.0
 */
public enum EventKind {
  /**
   * An element has been opened. The event value is the element name.
   */
  START("start"),

  /**
   * An element has been closed. The event value is the element name.
   */
  END("end"),

  /**
   * A contiguous run of character data. The event value is the text.
   */
  TEXT("text"),

  /**
   * A self-closing element such as <code>&lt;a/&gt;</code>. The event value
   * is the element name.
   */
  EMPTY("empty");

  private final String label;

  EventKind(String label) {
    this.label = label;
  }

  /**
   * @return the lower-case label of this kind (<code>start</code>,
   * <code>end</code>, <code>text</code> or <code>empty</code>)
   */
  public String getLabel() {
    return label;
  }

  @Override
  public String toString() {
    return label;
  }
}
