package io.pdslabel.parser.api;

/**
 * Thrown when a literal is recognised but its contents are invalid: a digit outside the radix, a
 * day that does not exist, an unterminated quote, a non-ASCII byte.
 */
public class MalformedLiteralException extends LabelParseException {

  public MalformedLiteralException(String message, long position, String lexeme) {
    super(message, null, position, lexeme, "MALFORMED_LITERAL");
  }

  public MalformedLiteralException(
      String message, Throwable cause, long position, String lexeme) {
    super(message, cause, position, lexeme, "MALFORMED_LITERAL");
  }

  /**
   * Creates a MalformedLiteralException for a literal rejected by value validation.
   *
   * @param cause the validation failure
   * @param position the offset of the literal
   * @param lexeme the literal text
   * @return a new MalformedLiteralException instance
   */
  public static MalformedLiteralException invalidValue(
      LabelValidationException cause, long position, String lexeme) {
    return new MalformedLiteralException(
        "Invalid literal: " + cause.getReason(), cause, position, lexeme);
  }
}
