package io.pdslabel.parser.api.statements;

import io.pdslabel.parser.api.Identifier;

/** One entry of a {@link Statements} container. */
public sealed interface Statement permits AttributeStatement, GroupStatement, ObjectStatement {

  Identifier identifier();

  StatementKind kind();

  /**
   * Returns an independent deep copy of this statement.
   *
   * @return the copy
   */
  Statement copy();
}
