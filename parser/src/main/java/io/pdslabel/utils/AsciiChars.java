package io.pdslabel.utils;

/**
 * Character classes of the label grammar.
 *
 * <p>All predicates take an {@code int} so that the scanner's end-of-input marker ({@code -1})
 * and bytes above {@code 0x7F} simply fail to match.
 */
public final class AsciiChars {
  private AsciiChars() {}

  public static boolean isAscii(int c) {
    return c >= 0 && c <= 0x7F;
  }

  public static boolean isLetter(int c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
  }

  public static boolean isDigit(int c) {
    return c >= '0' && c <= '9';
  }

  public static boolean isLetterOrDigit(int c) {
    return isLetter(c) || isDigit(c);
  }

  /** Letters, digits and the underscore. */
  public static boolean isIdentifierChar(int c) {
    return isLetterOrDigit(c) || c == '_';
  }

  /** Printable ASCII, {@code 0x20} (space) through {@code 0x7E} ({@code ~}). */
  public static boolean isPrintable(int c) {
    return c >= 0x20 && c <= 0x7E;
  }

  /** Space, tab, line feed, vertical tab, form feed and carriage return. */
  public static boolean isWhitespace(int c) {
    return c == ' ' || c == '\t' || c == '\n' || c == 0x0B || c == '\f' || c == '\r';
  }

  /**
   * Gets the numeric value of a digit in the given radix.
   *
   * @param c the digit character
   * @param radix the radix, 2 to 16
   * @return the digit value, or {@code -1} if {@code c} is not a digit of that radix
   */
  public static int digitValue(int c, int radix) {
    int v;
    if (isDigit(c)) {
      v = c - '0';
    } else if (c >= 'A' && c <= 'Z') {
      v = c - 'A' + 10;
    } else if (c >= 'a' && c <= 'z') {
      v = c - 'a' + 10;
    } else {
      return -1;
    }
    return v < radix ? v : -1;
  }

  /**
   * Renders a character for error messages: printable characters as themselves, anything else as
   * a {@code 0x..} escape.
   */
  public static String describe(int c) {
    if (c < 0) {
      return "<end of input>";
    }
    return isPrintable(c) ? String.valueOf((char) c) : String.format("0x%02X", c);
  }
}
