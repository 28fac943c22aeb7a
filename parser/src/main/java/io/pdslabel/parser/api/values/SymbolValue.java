package io.pdslabel.parser.api.values;

import io.pdslabel.parser.api.LabelValidationException;
import io.pdslabel.utils.AsciiChars;
import java.util.Locale;

/**
 * Single-quoted symbolic literal, e.g. {@code 'N/A'}. Non-empty, printable ASCII without the
 * apostrophe; stored in upper case.
 *
 * @param value the unquoted symbol
 */
public record SymbolValue(String value) implements Scalar {

  public SymbolValue {
    if (value == null || value.isEmpty()) {
      throw LabelValidationException.invalid("symbol", value);
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (!AsciiChars.isPrintable(c) || c == '\'') {
        throw LabelValidationException.invalid("symbol", value);
      }
    }
    value = value.toUpperCase(Locale.ROOT);
  }

  public static SymbolValue of(String value) {
    return new SymbolValue(value);
  }

  @Override
  public String toLabelString() {
    return '\'' + value + '\'';
  }

  @Override
  public String toString() {
    return toLabelString();
  }
}
