package io.pdslabel.parser.api.statements;

import io.pdslabel.parser.api.Identifier;
import io.pdslabel.parser.api.LabelValidationException;

/**
 * Named block of attributes, {@code GROUP = NAME ... END_GROUP = NAME}.
 *
 * @param identifier the group name, plain
 * @param statements the nested attributes
 */
public record GroupStatement(Identifier identifier, GroupStatements statements)
    implements Statement {

  public GroupStatement {
    BlockNames.check(identifier, "group");
    if (statements == null) {
      throw new LabelValidationException("group statements must not be null", identifier.text());
    }
  }

  public static GroupStatement of(String name, GroupStatements statements) {
    return new GroupStatement(Identifier.plain(name), statements);
  }

  @Override
  public StatementKind kind() {
    return StatementKind.GROUP;
  }

  @Override
  public GroupStatement copy() {
    return new GroupStatement(identifier, statements.copy());
  }
}
