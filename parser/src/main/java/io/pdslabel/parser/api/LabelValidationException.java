package io.pdslabel.parser.api;

/**
 * Thrown when a value, identifier or statement does not satisfy its syntactic constraints, or a
 * statement is put into a container that does not accept its kind.
 *
 * <p>This signals invalid API usage; malformed external input is reported by the parser as a
 * {@link LabelParseException} instead.
 */
public class LabelValidationException extends IllegalArgumentException {
  private final String reason;
  private final String context;

  public LabelValidationException(String reason) {
    this(reason, null);
  }

  public LabelValidationException(String reason, String context) {
    super(LabelParseException.formatMessage(reason, -1, context, "VALIDATION"));
    this.reason = reason;
    this.context = context;
  }

  /**
   * Creates a LabelValidationException for a string rejected by a value constructor.
   *
   * @param what the kind of value, e.g. "identifier"
   * @param value the rejected input
   * @return a new LabelValidationException instance
   */
  public static LabelValidationException invalid(String what, String value) {
    return new LabelValidationException(String.format("invalid %s", what), quote(value));
  }

  /**
   * Creates a LabelValidationException for a number outside its allowed range.
   *
   * @param field the field name, e.g. "month"
   * @param value the rejected value
   * @param min the lowest allowed value
   * @param max the highest allowed value
   * @return a new LabelValidationException instance
   */
  public static LabelValidationException outOfRange(
      String field, Object value, Object min, Object max) {
    return new LabelValidationException(
        String.format("%s %s is not between %s and %s", field, value, min, max));
  }

  private static String quote(String value) {
    if (value == null) {
      return "null";
    }
    StringBuilder sb = new StringBuilder("'");
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c >= 0x20 && c <= 0x7E) {
        sb.append(c);
      } else {
        sb.append(String.format("\\u%04x", (int) c));
      }
    }
    return sb.append('\'').toString();
  }

  /**
   * Gets the failure description without the context decoration.
   *
   * @return the reason
   */
  public String getReason() {
    return reason;
  }

  public String getContext() {
    return context;
  }
}
