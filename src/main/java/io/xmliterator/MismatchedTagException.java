package io.xmliterator;

/**
 * Thrown if an end tag does not match the element that is currently open
 * @since 1.0.0
 */
public class MismatchedTagException extends MalformedXMLException {
  private static final long serialVersionUID = -1573000871862436617L;

  private final String expected;
  private final String actual;

  /**
   * Create a new exception
   * @param expected the name of the open element (may be <code>null</code>
   * if no element was open)
   * @param actual the name found in the end tag
   * @param offset the offset of the end tag in the input
   */
  public MismatchedTagException(String expected, String actual, long offset) {
    this(expected, actual, offset, null);
  }

  /**
   * Create a new exception
   * @param expected the name of the open element (may be <code>null</code>
   * if no element was open)
   * @param actual the name found in the end tag
   * @param offset the offset of the end tag in the input
   * @param cause the parser failure that revealed the mismatch (may be
   * <code>null</code>)
   */
  public MismatchedTagException(String expected, String actual, long offset,
      Throwable cause) {
    super(expected == null ? "Unexpected end tag </" + actual + ">" :
        "Unexpected end tag </" + actual + ">; expected </" + expected + ">",
        offset, cause);
    this.expected = expected;
    this.actual = actual;
  }

  /**
   * @return the name of the element that was open (may be <code>null</code>)
   */
  public String getExpected() {
    return expected;
  }

  /**
   * @return the name found in the end tag
   */
  public String getActual() {
    return actual;
  }
}
