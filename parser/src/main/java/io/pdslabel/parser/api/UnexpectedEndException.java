package io.pdslabel.parser.api;

/** Thrown when the input ends before the terminating {@code END} statement. */
public class UnexpectedEndException extends LabelParseException {

  public UnexpectedEndException(String message, long position) {
    super(message, null, position, null, "UNEXPECTED_END");
  }
}
