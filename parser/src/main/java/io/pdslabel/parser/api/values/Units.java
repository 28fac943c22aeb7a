package io.pdslabel.parser.api.values;

import io.pdslabel.parser.api.Identifier;
import io.pdslabel.parser.api.LabelValidationException;
import io.pdslabel.utils.AsciiChars;
import java.util.Locale;

/**
 * Units expression attached to a numeric value, such as {@code <KM/S>} or {@code <M**-2>}.
 *
 * <p>The grammar is {@code factor (('*' | '/') factor)*} with {@code factor = identifier ['**'
 * signed_integer]}. The expression is stored in upper case without the angle brackets.
 */
public record Units(String expression) {

  /**
   * Validates and canonicalizes the expression.
   *
   * @throws LabelValidationException if {@code expression} is not a units expression
   */
  public Units {
    if (expression == null || !isValid(expression)) {
      throw LabelValidationException.invalid("units expression", expression);
    }
    expression = expression.toUpperCase(Locale.ROOT);
  }

  /**
   * Creates units from an expression.
   *
   * @param expression the expression without angle brackets, any case
   * @return the units
   */
  public static Units of(String expression) {
    return new Units(expression);
  }

  static boolean isValid(String expr) {
    int pos = 0;
    int len = expr.length();
    while (true) {
      int start = pos;
      while (pos < len && AsciiChars.isIdentifierChar(expr.charAt(pos))) {
        pos++;
      }
      if (!Identifier.isValidName(expr.substring(start, pos))) {
        return false;
      }
      if (expr.startsWith("**", pos)) {
        pos += 2;
        if (pos < len && (expr.charAt(pos) == '+' || expr.charAt(pos) == '-')) {
          pos++;
        }
        int digits = pos;
        while (pos < len && AsciiChars.isDigit(expr.charAt(pos))) {
          pos++;
        }
        if (pos == digits) {
          return false;
        }
      }
      if (pos == len) {
        return true;
      }
      char op = expr.charAt(pos);
      if (op != '*' && op != '/') {
        return false;
      }
      pos++;
    }
  }

  /**
   * Renders the expression in angle brackets.
   *
   * @return e.g. {@code <KM/S>}
   */
  public String toLabelString() {
    return "<" + expression + ">";
  }

  @Override
  public String toString() {
    return toLabelString();
  }
}
