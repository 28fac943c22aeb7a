package io.pdslabel.parser.api.statements;

import java.util.EnumSet;
import java.util.List;

/**
 * Top-level label document: the statements before the terminating {@code END}. The terminator is
 * implied and written by the serializer; it is not stored.
 */
public final class Label extends Statements {

  public Label(Statement... statements) {
    this(List.of(statements));
  }

  public Label(Iterable<? extends Statement> statements) {
    super(EnumSet.allOf(StatementKind.class), statements);
  }

  @Override
  public Label copy() {
    return copyInto(new Label());
  }
}
