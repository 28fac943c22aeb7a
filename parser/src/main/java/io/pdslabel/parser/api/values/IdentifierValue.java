package io.pdslabel.parser.api.values;

import io.pdslabel.parser.api.Identifier;
import io.pdslabel.parser.api.LabelValidationException;

/**
 * Bare identifier used as a value, as in {@code TARGET_NAME = MARS}.
 *
 * @param identifier the wrapped identifier, plain
 */
public record IdentifierValue(Identifier identifier) implements Scalar {

  public IdentifierValue {
    if (identifier == null || !identifier.isPlain()) {
      throw LabelValidationException.invalid(
          "identifier value", identifier == null ? null : identifier.text());
    }
  }

  public static IdentifierValue of(String name) {
    return new IdentifierValue(Identifier.plain(name));
  }

  @Override
  public String toLabelString() {
    return identifier.text();
  }

  @Override
  public String toString() {
    return toLabelString();
  }
}
