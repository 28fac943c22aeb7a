package io.pdslabel.parser.impl;

import io.pdslabel.parser.api.Identifier;
import io.pdslabel.parser.api.LabelParseException;
import io.pdslabel.parser.api.LabelValidationException;
import io.pdslabel.parser.api.MalformedLiteralException;
import io.pdslabel.parser.api.values.BasedIntegerValue;
import io.pdslabel.parser.api.values.DateTimeValue;
import io.pdslabel.parser.api.values.DateValue;
import io.pdslabel.parser.api.values.IdentifierValue;
import io.pdslabel.parser.api.values.IntegerValue;
import io.pdslabel.parser.api.values.RealValue;
import io.pdslabel.parser.api.values.Scalar;
import io.pdslabel.parser.api.values.Sequence1D;
import io.pdslabel.parser.api.values.Sequence2D;
import io.pdslabel.parser.api.values.SetValue;
import io.pdslabel.parser.api.values.SymbolValue;
import io.pdslabel.parser.api.values.TextValue;
import io.pdslabel.parser.api.values.TimeValue;
import io.pdslabel.parser.api.values.Units;
import io.pdslabel.parser.api.values.Value;
import io.pdslabel.parser.internal_api.LabelScanner;
import io.pdslabel.utils.AsciiChars;
import java.math.BigDecimal;
import java.util.function.Supplier;

/**
 * Value sub-grammar of the label parser.
 *
 * <p>The leading character selects the production: {@code (} sequence, <code>{</code> set,
 * {@code "} text, {@code '} symbol, a letter an identifier, and a digit, sign or dot one of the
 * numeric and calendar literals. Numeric literals are told apart by the character following the
 * first digit run ({@code #} based integer, {@code -} date, {@code :} time, {@code .} or exponent
 * real), which needs at most three bytes of look-ahead.
 */
final class ValueReader {
  private final LabelScanner scanner;

  ValueReader(LabelScanner scanner) {
    this.scanner = scanner;
  }

  /** value := scalar | sequence | set */
  Value readValue() throws LabelParseException {
    skip();
    int c = scanner.peek();
    if (c == '(') {
      return readSequence();
    }
    if (c == '{') {
      return readSet();
    }
    return readScalar();
  }

  /** scalar := numeric [units] | date | time | date_time | text | symbol | identifier */
  Scalar readScalar() throws LabelParseException {
    skip();
    int c = scanner.peek();
    if (c == '"') {
      return readText();
    }
    if (c == '\'') {
      return readSymbol();
    }
    if (AsciiChars.isLetter(c)) {
      long start = scanner.position();
      String word = scanner.readWord();
      return build(() -> new IdentifierValue(Identifier.plain(word)), start);
    }
    if (AsciiChars.isDigit(c)) {
      return readNumberOrCalendar();
    }
    if (c == '+' || c == '-' || c == '.') {
      return readDecimal(scanner.position());
    }
    throw unexpected("value");
  }

  private Value readSequence() throws LabelParseException {
    scanner.next(); // (
    skip();
    if (scanner.peek() != '(') {
      return readSequenceTail();
    }
    Sequence2D rows = new Sequence2D();
    do {
      skip();
      if (!scanner.match('(')) {
        throw unexpected("'('");
      }
      rows.add(readSequenceTail());
    } while (separator(')'));
    return rows;
  }

  /** Reads {@code scalar (',' scalar)* ')'}, the opening parenthesis already consumed. */
  private Sequence1D readSequenceTail() throws LabelParseException {
    Sequence1D seq = new Sequence1D();
    do {
      seq.add(readScalar());
    } while (separator(')'));
    return seq;
  }

  private SetValue readSet() throws LabelParseException {
    scanner.next(); // {
    SetValue set = new SetValue();
    skip();
    if (scanner.match('}')) {
      return set;
    }
    do {
      skip();
      long start = scanner.position();
      Scalar member = readScalar();
      if (!(member instanceof IntegerValue) && !(member instanceof SymbolValue)) {
        throw new MalformedLiteralException(
            "Set members must be integers or symbols", start, scanner.text(start, scanner.position()));
      }
      set.add(member);
    } while (separator('}'));
    return set;
  }

  /**
   * Consumes a list separator or the closing delimiter.
   *
   * @return {@code true} after a comma, {@code false} after the closing delimiter
   */
  private boolean separator(char close) throws LabelParseException {
    skip();
    if (scanner.match(',')) {
      return true;
    }
    if (scanner.match(close)) {
      return false;
    }
    throw unexpected("',' or '" + close + "'");
  }

  private TextValue readText() throws LabelParseException {
    long start = scanner.position();
    scanner.next(); // "
    long from = scanner.position();
    while (true) {
      int c = scanner.next();
      if (c == LabelScanner.EOF) {
        throw new MalformedLiteralException(
            "Unterminated text literal", start, scanner.lexemeAt(start));
      }
      if (c == '"') {
        break;
      }
      if (!AsciiChars.isAscii(c)) {
        throw nonAscii(c, scanner.position() - 1);
      }
    }
    String text = scanner.text(from, scanner.position() - 1);
    return build(() -> new TextValue(text), start);
  }

  private SymbolValue readSymbol() throws LabelParseException {
    long start = scanner.position();
    scanner.next(); // '
    long from = scanner.position();
    while (true) {
      int c = scanner.next();
      if (c == LabelScanner.EOF) {
        throw new MalformedLiteralException(
            "Unterminated symbol literal", start, scanner.lexemeAt(start));
      }
      if (c == '\'') {
        break;
      }
      if (!AsciiChars.isAscii(c)) {
        throw nonAscii(c, scanner.position() - 1);
      }
      if (!AsciiChars.isPrintable(c)) {
        throw new MalformedLiteralException(
            "Control character " + AsciiChars.describe(c) + " in symbol literal",
            scanner.position() - 1,
            scanner.text(start, scanner.position() - 1));
      }
    }
    String symbol = scanner.text(from, scanner.position() - 1);
    return build(() -> new SymbolValue(symbol), start);
  }

  private Scalar readNumberOrCalendar() throws LabelParseException {
    long start = scanner.position();
    int digits = scanner.runLength(0, AsciiChars::isDigit);
    int next = scanner.peek(digits);
    int after = scanner.peek(digits + 1);
    if (next == '#') {
      return readBasedInteger(start);
    }
    if (next == '-' && AsciiChars.isDigit(after)) {
      return readDateOrDateTime(start);
    }
    if (next == ':' && AsciiChars.isDigit(after)) {
      return readTime(start);
    }
    return readDecimal(start);
  }

  /** based_integer := radix '#' [sign] digits '#' [units] */
  private Scalar readBasedInteger(long start) throws LabelParseException {
    int radix = intField(scanner.readRun(AsciiChars::isDigit), start);
    scanner.next(); // #
    long digitsStart = scanner.position();
    if (scanner.peek() == '+' || scanner.peek() == '-') {
      scanner.next();
    }
    scanner.readRun(AsciiChars::isLetterOrDigit);
    String digits = scanner.text(digitsStart, scanner.position());
    if (!scanner.match('#')) {
      throw new MalformedLiteralException(
          "Unterminated based integer", start, scanner.text(start, scanner.position()));
    }
    Units units = readUnits();
    return build(() -> new BasedIntegerValue(radix, digits, units), start);
  }

  /** integer | real, each with optional units */
  private Scalar readDecimal(long start) throws LabelParseException {
    if (scanner.peek() == '+' || scanner.peek() == '-') {
      scanner.next();
    }
    int intDigits = scanner.readRun(AsciiChars::isDigit).length();
    boolean real = false;
    int fracDigits = 0;
    if (scanner.peek() == '.') {
      fracDigits = scanner.runLength(1, AsciiChars::isDigit);
      if (intDigits == 0 && fracDigits == 0) {
        scanner.position(start);
        throw unexpected("number");
      }
      scanner.next();
      scanner.readRun(AsciiChars::isDigit);
      real = true;
    }
    if (intDigits == 0 && fracDigits == 0) {
      scanner.position(start);
      throw unexpected("number");
    }
    int e = scanner.peek();
    if (e == 'e' || e == 'E') {
      int sign = scanner.peek(1) == '+' || scanner.peek(1) == '-' ? 1 : 0;
      if (AsciiChars.isDigit(scanner.peek(1 + sign))) {
        scanner.position(scanner.position() + 1 + sign);
        scanner.readRun(AsciiChars::isDigit);
        real = true;
      }
    }
    String text = scanner.text(start, scanner.position());
    Units units = readUnits();
    if (real) {
      return build(() -> RealValue.parse(text, units), start);
    }
    return build(() -> IntegerValue.parse(text, units), start);
  }

  /** units := '<' units_expression '>'; whitespace inside the brackets is dropped */
  private Units readUnits() throws LabelParseException {
    long end = scanner.position();
    skip();
    if (scanner.peek() != '<') {
      scanner.position(end);
      return null;
    }
    long start = scanner.position();
    scanner.next();
    StringBuilder expr = new StringBuilder();
    while (true) {
      int c = scanner.next();
      if (c == LabelScanner.EOF) {
        throw new MalformedLiteralException(
            "Unterminated units expression", start, scanner.lexemeAt(start));
      }
      if (c == '>') {
        break;
      }
      if (!AsciiChars.isAscii(c)) {
        throw nonAscii(c, scanner.position() - 1);
      }
      if (!AsciiChars.isWhitespace(c)) {
        expr.append((char) c);
      }
    }
    String text = expr.toString();
    return build(() -> Units.of(text), start);
  }

  /** date := year '-' [month '-'] day; date_time := date 'T' time */
  private Scalar readDateOrDateTime(long start) throws LabelParseException {
    int year = intField(scanner.readRun(AsciiChars::isDigit), start);
    scanner.next(); // -
    int second = intField(scanner.readRun(AsciiChars::isDigit), start);
    Integer month = null;
    int day = second;
    if (scanner.peek() == '-' && AsciiChars.isDigit(scanner.peek(1))) {
      scanner.next();
      month = second;
      day = intField(scanner.readRun(AsciiChars::isDigit), start);
    }
    Integer m = month;
    int d = day;
    DateValue date = build(() -> DateValue.of(year, m, d), start);
    int t = scanner.peek();
    if ((t == 'T' || t == 't') && AsciiChars.isDigit(scanner.peek(1))) {
      scanner.next();
      long timeStart = scanner.position();
      if (scanner.runLength(0, AsciiChars::isDigit) == 0
          || scanner.peek(scanner.runLength(0, AsciiChars::isDigit)) != ':') {
        throw new MalformedLiteralException(
            "Expected time after 'T'", timeStart, scanner.lexemeAt(timeStart));
      }
      TimeValue time = readTime(timeStart);
      return build(() -> new DateTimeValue(date, time), start);
    }
    return date;
  }

  /** time := hour ':' minute [':' second] ['Z' | ('+' | '-') zone_hour [':' zone_minute]] */
  private TimeValue readTime(long start) throws LabelParseException {
    int hour = intField(scanner.readRun(AsciiChars::isDigit), start);
    scanner.next(); // :
    String minuteText = scanner.readRun(AsciiChars::isDigit);
    if (minuteText.isEmpty()) {
      throw new MalformedLiteralException(
          "Expected minutes", scanner.position(), scanner.text(start, scanner.position()));
    }
    int minute = intField(minuteText, start);
    BigDecimal second = null;
    if (scanner.peek() == ':'
        && (AsciiChars.isDigit(scanner.peek(1))
            || (scanner.peek(1) == '.' && AsciiChars.isDigit(scanner.peek(2))))) {
      scanner.next();
      long secondStart = scanner.position();
      scanner.readRun(AsciiChars::isDigit);
      if (scanner.match('.')) {
        scanner.readRun(AsciiChars::isDigit);
      }
      String secondText = scanner.text(secondStart, scanner.position());
      second = new BigDecimal(secondText.endsWith(".") ? secondText + "0" : secondText);
    }
    boolean utc = false;
    Integer zoneHour = null;
    Integer zoneMinute = null;
    int z = scanner.peek();
    if (z == 'Z' || z == 'z') {
      scanner.next();
      utc = true;
    } else if ((z == '+' || z == '-') && AsciiChars.isDigit(scanner.peek(1))) {
      scanner.next();
      int zh = intField(scanner.readRun(AsciiChars::isDigit), start);
      zoneHour = z == '-' ? -zh : zh;
      if (scanner.peek() == ':' && AsciiChars.isDigit(scanner.peek(1))) {
        scanner.next();
        zoneMinute = intField(scanner.readRun(AsciiChars::isDigit), start);
      }
    }
    BigDecimal s = second;
    boolean u = utc;
    Integer zh = zoneHour;
    Integer zm = zoneMinute;
    return build(() -> TimeValue.of(hour, minute, s, u, zh, zm), start);
  }

  private int intField(String digits, long start) throws MalformedLiteralException {
    if (digits.isEmpty() || digits.length() > 9) {
      throw new MalformedLiteralException(
          "Numeric field out of range", start, scanner.text(start, scanner.position()));
    }
    return Integer.parseInt(digits);
  }

  /** Runs a value constructor, reporting validation failures as malformed literals. */
  private <T> T build(Supplier<T> constructor, long start) throws MalformedLiteralException {
    try {
      return constructor.get();
    } catch (LabelValidationException e) {
      throw MalformedLiteralException.invalidValue(
          e, start, scanner.text(start, scanner.position()));
    }
  }

  private void skip() throws LabelParseException {
    LabelParserImpl.skip(scanner);
  }

  private LabelParseException unexpected(String expected) {
    return LabelParserImpl.unexpected(scanner, expected);
  }

  private MalformedLiteralException nonAscii(int c, long at) {
    return LabelParserImpl.nonAscii(scanner, c, at);
  }
}
