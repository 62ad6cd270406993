package io.xmliterator;

/**
 * Thrown if the input bytes cannot be interpreted under the resolved
 * character encoding
 * @since 1.0.0
 */
public class DecodeException extends XMLIteratorException {
  private static final long serialVersionUID = -2430950366921163087L;

  /**
   * Create a new exception
   * @param message the detail message
   * @param offset the offset in the input or <code>-1</code> if unknown
   * @param cause the underlying cause
   */
  public DecodeException(String message, long offset, Throwable cause) {
    super(message, offset, cause);
  }
}
