package io.pdslabel.parser.internal_api;

import io.pdslabel.utils.AsciiChars;
import io.pdslabel.utils.ByteSource;
import java.util.function.IntPredicate;

/**
 * Cursor over a {@link ByteSource} with the lexical helpers of the label grammar.
 *
 * <p>None of the matching methods throw: a failed match leaves the cursor where it was and reports
 * "no match" through its return value, and the parser decides whether that is fatal. Reading past
 * the end yields {@link #EOF}.
 */
public final class LabelScanner {
  /** Returned by {@link #peek()} at the end of the input. */
  public static final int EOF = -1;

  private static final int MAX_LEXEME = 40;

  private final ByteSource source;
  private final long length;
  private long pos;

  public LabelScanner(ByteSource source) {
    this.source = source;
    this.length = source.length();
  }

  public long position() {
    return pos;
  }

  public void position(long position) {
    this.pos = position;
  }

  public boolean eof() {
    return pos >= length;
  }

  /**
   * Gets the byte under the cursor.
   *
   * @return the unsigned byte value, or {@link #EOF}
   */
  public int peek() {
    return peek(0);
  }

  /**
   * Gets the byte {@code ahead} positions after the cursor.
   *
   * @param ahead the look-ahead distance
   * @return the unsigned byte value, or {@link #EOF}
   */
  public int peek(int ahead) {
    long at = pos + ahead;
    return at < length ? source.get(at) & 0xFF : EOF;
  }

  /**
   * Consumes one byte.
   *
   * @return the consumed byte, or {@link #EOF} without moving
   */
  public int next() {
    int c = peek();
    if (c != EOF) {
      pos++;
    }
    return c;
  }

  /**
   * Skips whitespace and {@code /* ... *}{@code /} comments. A comment must close on the line it
   * opens; an unterminated one is left in place for the caller to report.
   *
   * @return {@code true} if the cursor now sits on an unterminated comment
   */
  public boolean skipInsignificant() {
    while (true) {
      while (AsciiChars.isWhitespace(peek())) {
        pos++;
      }
      if (peek() != '/' || peek(1) != '*') {
        return false;
      }
      long end = findCommentEnd(pos + 2);
      if (end < 0) {
        return true;
      }
      pos = end;
    }
  }

  private long findCommentEnd(long from) {
    for (long at = from; at < length; at++) {
      int c = source.get(at) & 0xFF;
      if (c == '\r' || c == '\n') {
        return -1;
      }
      if (c == '*' && at + 1 < length && source.get(at + 1) == '/') {
        return at + 2;
      }
    }
    return -1;
  }

  /**
   * Consumes a single expected character.
   *
   * @param c the character
   * @return {@code true} if it was present and consumed
   */
  public boolean match(char c) {
    if (peek() == c) {
      pos++;
      return true;
    }
    return false;
  }

  /**
   * Consumes the longest run of bytes matching a character class.
   *
   * @param charClass the class
   * @return the run, possibly empty
   */
  public String readRun(IntPredicate charClass) {
    long start = pos;
    while (charClass.test(peek())) {
      pos++;
    }
    return source.ascii(start, pos);
  }

  /**
   * Measures the run of bytes matching a character class starting {@code ahead} positions after
   * the cursor, without consuming anything.
   *
   * @return the run length
   */
  public int runLength(int ahead, IntPredicate charClass) {
    int n = 0;
    while (charClass.test(peek(ahead + n))) {
      n++;
    }
    return n;
  }

  /**
   * Consumes a run of identifier characters: {@code letter (letter | digit | '_')*}.
   *
   * @return the run, or an empty string if the cursor is not on a letter
   */
  public String readWord() {
    if (!AsciiChars.isLetter(peek())) {
      return "";
    }
    return readRun(AsciiChars::isIdentifierChar);
  }

  /**
   * Copies a region of the input.
   *
   * @param from the first index
   * @param to the end index, exclusive
   * @return the region as ASCII text
   */
  public String text(long from, long to) {
    return source.ascii(from, Math.min(to, length));
  }

  /**
   * Describes the token at a position for error messages: a word, a number-ish run, or a single
   * character, truncated to a readable length.
   *
   * @param at the position
   * @return the lexeme, or {@code null} at the end of the input
   */
  public String lexemeAt(long at) {
    if (at >= length) {
      return null;
    }
    int first = source.get(at) & 0xFF;
    if (!AsciiChars.isIdentifierChar(first)) {
      return AsciiChars.describe(first);
    }
    long end = at;
    while (end < length && end - at < MAX_LEXEME && isWordish(source.get(end) & 0xFF)) {
      end++;
    }
    return source.ascii(at, end);
  }

  private static boolean isWordish(int c) {
    return AsciiChars.isIdentifierChar(c) || c == '.' || c == '#';
  }
}
