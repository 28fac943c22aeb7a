package io.pdslabel.parser.api.statements;

import java.util.EnumSet;
import java.util.List;

/** Body of a {@link GroupStatement}. Accepts attributes only. */
public final class GroupStatements extends Statements {

  public GroupStatements(Statement... statements) {
    this(List.of(statements));
  }

  public GroupStatements(Iterable<? extends Statement> statements) {
    super(EnumSet.of(StatementKind.ATTRIBUTE), statements);
  }

  @Override
  public GroupStatements copy() {
    return copyInto(new GroupStatements());
  }
}
