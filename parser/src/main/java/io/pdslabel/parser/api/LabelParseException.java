package io.pdslabel.parser.api;

/**
 * Base exception for all label parsing errors.
 *
 * <p>Carries the byte offset at which parsing failed and the offending lexeme, so callers can point
 * at the broken part of the input. A parse either produces a complete {@code Label} or throws; no
 * partial result is ever returned.
 */
public class LabelParseException extends Exception {
  private final long position;
  private final String context;
  private final String errorCode;

  public LabelParseException(String message, long position, String context) {
    this(message, null, position, context, "UNEXPECTED_TOKEN");
  }

  public LabelParseException(
      String message, Throwable cause, long position, String context, String errorCode) {
    super(formatMessage(message, position, context, errorCode), cause);
    this.position = position;
    this.context = context;
    this.errorCode = errorCode;
  }

  static String formatMessage(String message, long position, String context, String errorCode) {
    StringBuilder sb = new StringBuilder(message);
    if (position >= 0) {
      sb.append(" at offset ").append(position);
    }
    if (context != null) {
      sb.append(" [Context: ").append(context).append("]");
    }
    if (errorCode != null) {
      sb.append(" [Error Code: ").append(errorCode).append("]");
    }
    return sb.toString();
  }

  /**
   * Gets the byte offset of the offending lexeme.
   *
   * @return the offset into the parsed input
   */
  public long position() {
    return position;
  }

  /**
   * Gets the offending lexeme.
   *
   * @return the lexeme text, or {@code null} when the input ended
   */
  public String getContext() {
    return context;
  }

  public String getErrorCode() {
    return errorCode;
  }
}
