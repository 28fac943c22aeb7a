package io.pdslabel.parser.api.values;

import io.pdslabel.parser.api.LabelValidationException;

/**
 * Quoted text. May contain any ASCII character, line breaks included, except the double quote.
 * The content is kept and rendered exactly as given.
 *
 * @param value the unquoted text
 */
public record TextValue(String value) implements Scalar {

  public TextValue {
    if (value == null) {
      throw LabelValidationException.invalid("text", null);
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c > 0x7F || c == '"') {
        throw LabelValidationException.invalid("text", value);
      }
    }
  }

  public static TextValue of(String value) {
    return new TextValue(value);
  }

  @Override
  public String toLabelString() {
    return '"' + value + '"';
  }

  @Override
  public String toString() {
    return toLabelString();
  }
}
