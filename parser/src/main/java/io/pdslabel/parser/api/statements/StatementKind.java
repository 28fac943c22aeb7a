package io.pdslabel.parser.api.statements;

/** The three statement forms, with the keywords the serializer writes for them. */
public enum StatementKind {
  ATTRIBUTE(null, null),
  GROUP("GROUP", "END_GROUP"),
  OBJECT("OBJECT", "END_OBJECT");

  private final String openKeyword;
  private final String closeKeyword;

  StatementKind(String openKeyword, String closeKeyword) {
    this.openKeyword = openKeyword;
    this.closeKeyword = closeKeyword;
  }

  /**
   * Gets the keyword on a block's opening line.
   *
   * @return {@code GROUP}/{@code OBJECT}, or {@code null} for attributes
   */
  public String openKeyword() {
    return openKeyword;
  }

  /**
   * Gets the keyword on a block's closing line.
   *
   * @return {@code END_GROUP}/{@code END_OBJECT}, or {@code null} for attributes
   */
  public String closeKeyword() {
    return closeKeyword;
  }
}
