package io.xmliterator;

/**
 * Base class for all failures that can happen while turning an XML document
 * into a stream of events
 * @since 1.0.0
 */
public class XMLIteratorException extends RuntimeException {
  private static final long serialVersionUID = 5281377406447916583L;

  /**
   * The offset in the input where the failure was detected
   */
  private final long offset;

  /**
   * Create a new exception
   * @param message the detail message
   * @param offset the offset in the input where the failure was detected
   * or <code>-1</code> if it is unknown
   * @param cause the underlying cause (may be <code>null</code>)
   */
  public XMLIteratorException(String message, long offset, Throwable cause) {
    super(offset < 0 ? message : message + " (at offset " + offset + ")", cause);
    this.offset = offset;
  }

  /**
   * @return the offset in the input where the failure was detected or
   * <code>-1</code> if it is unknown
   */
  public long getOffset() {
    return offset;
  }
}
