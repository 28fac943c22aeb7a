package io.pdslabel.parser.api.statements;

import io.pdslabel.parser.api.Identifier;
import io.pdslabel.parser.api.LabelValidationException;

/**
 * Named block of attributes, groups and nested objects, {@code OBJECT = NAME ... END_OBJECT =
 * NAME}. Objects nest to any depth.
 *
 * @param identifier the object name, plain
 * @param statements the nested statements
 */
public record ObjectStatement(Identifier identifier, ObjectStatements statements)
    implements Statement {

  public ObjectStatement {
    BlockNames.check(identifier, "object");
    if (statements == null) {
      throw new LabelValidationException("object statements must not be null", identifier.text());
    }
  }

  public static ObjectStatement of(String name, ObjectStatements statements) {
    return new ObjectStatement(Identifier.plain(name), statements);
  }

  @Override
  public StatementKind kind() {
    return StatementKind.OBJECT;
  }

  @Override
  public ObjectStatement copy() {
    return new ObjectStatement(identifier, statements.copy());
  }
}
