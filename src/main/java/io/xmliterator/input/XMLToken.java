package io.xmliterator.input;

/**
 * A raw lexical token produced by {@link XMLTokenizer}
 * @since 1.0.0
 */
public class XMLToken {
  /**
   * The kinds of tokens the tokenizer reports. Comments, processing
   * instructions and the document type declaration are never reported.
   */
  public enum Type {
    START_ELEMENT,
    END_ELEMENT,
    EMPTY_ELEMENT,
    TEXT
  }

  private final Type type;
  private final String value;
  private final long pos;

  /**
   * Constructs a new token
   * @param type the token type
   * @param pos the position in the XML stream where the token has occurred
   * @param value the qualified element name or, for {@link Type#TEXT}, the
   * character data
   */
  public XMLToken(Type type, long pos, String value) {
    this.type = type;
    this.value = value;
    this.pos = pos;
  }

  /**
   * @return the token type
   */
  public Type getType() {
    return type;
  }

  /**
   * @return the position in the XML stream where the token has occurred
   */
  public long getPos() {
    return pos;
  }

  /**
   * @return the qualified element name or the character data
   */
  public String getValue() {
    return value;
  }

  @Override
  public String toString() {
    return type + "(" + value + ")@" + getPos();
  }
}
