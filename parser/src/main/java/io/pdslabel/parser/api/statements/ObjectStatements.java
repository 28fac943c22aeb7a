package io.pdslabel.parser.api.statements;

import java.util.EnumSet;
import java.util.List;

/** Body of an {@link ObjectStatement}. Accepts attributes, groups and nested objects. */
public final class ObjectStatements extends Statements {

  public ObjectStatements(Statement... statements) {
    this(List.of(statements));
  }

  public ObjectStatements(Iterable<? extends Statement> statements) {
    super(EnumSet.allOf(StatementKind.class), statements);
  }

  @Override
  public ObjectStatements copy() {
    return copyInto(new ObjectStatements());
  }
}
