package io.pdslabel.parser.api;

/**
 * Thrown when a {@code GROUP}/{@code OBJECT} block is closed by the wrong terminator, closed under
 * a different name, or never closed at all.
 */
public class MismatchedBlockException extends LabelParseException {

  public MismatchedBlockException(String message, long position, String lexeme) {
    super(message, null, position, lexeme, "MISMATCHED_BLOCK");
  }

  /**
   * Creates a MismatchedBlockException for an {@code END_GROUP = X} / {@code END_OBJECT = X}
   * whose name differs from the opening one.
   *
   * @param opened the name the block was opened with
   * @param closed the name the block was closed with
   * @param position the offset of the closing name
   * @return a new MismatchedBlockException instance
   */
  public static MismatchedBlockException nameMismatch(
      Identifier opened, String closed, long position) {
    return new MismatchedBlockException(
        String.format("Block '%s' closed as '%s'", opened, closed), position, closed);
  }
}
