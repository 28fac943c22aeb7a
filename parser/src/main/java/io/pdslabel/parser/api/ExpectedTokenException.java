package io.pdslabel.parser.api;

/**
 * Thrown when a required token is missing, e.g. the {@code =} of an assignment or the
 * {@code ,} between sequence elements.
 */
public class ExpectedTokenException extends LabelParseException {
  private final String expected;

  public ExpectedTokenException(String expected, long position, String found) {
    super(
        String.format("Expected %s instead of '%s'", expected, found),
        null,
        position,
        found,
        "EXPECTED_TOKEN");
    this.expected = expected;
  }

  /**
   * Gets a description of the token the parser was looking for.
   *
   * @return the expected token description
   */
  public String expected() {
    return expected;
  }
}
