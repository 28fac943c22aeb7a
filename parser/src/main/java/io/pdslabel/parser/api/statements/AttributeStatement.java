package io.pdslabel.parser.api.statements;

import io.pdslabel.parser.api.Identifier;
import io.pdslabel.parser.api.LabelValidationException;
import io.pdslabel.parser.api.values.Value;

/**
 * Attribute assignment, {@code IDENTIFIER = value}.
 *
 * @param identifier the attribute name; may be namespaced or a pointer
 * @param value the assigned value
 */
public record AttributeStatement(Identifier identifier, Value value) implements Statement {

  public AttributeStatement {
    if (identifier == null) {
      throw new LabelValidationException("attribute identifier must not be null");
    }
    if (value == null) {
      throw new LabelValidationException("attribute value must not be null", identifier.text());
    }
  }

  /**
   * Creates an attribute.
   *
   * @param identifier the identifier text, any case
   * @param value the value
   * @return the attribute
   * @throws LabelValidationException if the identifier is invalid
   */
  public static AttributeStatement of(String identifier, Value value) {
    return new AttributeStatement(Identifier.of(identifier), value);
  }

  @Override
  public StatementKind kind() {
    return StatementKind.ATTRIBUTE;
  }

  @Override
  public AttributeStatement copy() {
    return new AttributeStatement(identifier, value.copy());
  }
}
