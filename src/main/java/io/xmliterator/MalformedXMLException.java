package io.xmliterator;

/**
 * Thrown on a lexical or structural violation in the XML input (unclosed
 * tag, mismatched end tag, invalid character, etc.)
 * @since 1.0.0
 */
public class MalformedXMLException extends XMLIteratorException {
  private static final long serialVersionUID = 7339011406102543520L;

  /**
   * Create a new exception
   * @param message the detail message
   * @param offset the offset in the input or <code>-1</code> if unknown
   * @param cause the underlying cause (may be <code>null</code>)
   */
  public MalformedXMLException(String message, long offset, Throwable cause) {
    super(message, offset, cause);
  }
}
