package io.pdslabel.parser.impl;

import io.pdslabel.parser.api.ExpectedTokenException;
import io.pdslabel.parser.api.Identifier;
import io.pdslabel.parser.api.LabelParseException;
import io.pdslabel.parser.api.LabelParser;
import io.pdslabel.parser.api.LabelValidationException;
import io.pdslabel.parser.api.MalformedLiteralException;
import io.pdslabel.parser.api.MismatchedBlockException;
import io.pdslabel.parser.api.UnexpectedEndException;
import io.pdslabel.parser.api.statements.AttributeStatement;
import io.pdslabel.parser.api.statements.GroupStatement;
import io.pdslabel.parser.api.statements.GroupStatements;
import io.pdslabel.parser.api.statements.Label;
import io.pdslabel.parser.api.statements.ObjectStatement;
import io.pdslabel.parser.api.statements.ObjectStatements;
import io.pdslabel.parser.api.statements.StatementKind;
import io.pdslabel.parser.api.statements.Statements;
import io.pdslabel.parser.api.values.Value;
import io.pdslabel.parser.internal_api.LabelScanner;
import io.pdslabel.utils.AsciiChars;
import io.pdslabel.utils.ByteSource;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent label parser.
 *
 * <pre>
 * label     := statement* 'END'
 * statement := attribute | group | object
 * attribute := ['^'] [namespace ':'] name '=' value
 * group     := ('GROUP' | 'BEGIN_GROUP') '=' name attribute* 'END_GROUP' ['=' name]
 * object    := ('OBJECT' | 'BEGIN_OBJECT') '=' name statement* 'END_OBJECT' ['=' name]
 * </pre>
 *
 * Keywords are case-insensitive. Parsing stops right after {@code END}; anything behind it is not
 * read.
 */
public final class LabelParserImpl implements LabelParser {
  private static final Logger log = LoggerFactory.getLogger(LabelParserImpl.class);

  @Override
  public Label parse(ByteSource source) throws LabelParseException {
    log.debug("Parsing label from {} bytes", source.length());
    LabelScanner scanner = new LabelScanner(source);
    Label label = new Label();
    new Run(scanner).statements(label, null, null);
    log.debug(
        "Parsed label with {} top-level statements, END reached at offset {} of {}",
        label.size(),
        scanner.position(),
        source.length());
    return label;
  }

  /** State of a single parse. */
  private static final class Run {
    private final LabelScanner scanner;
    private final ValueReader values;

    Run(LabelScanner scanner) {
      this.scanner = scanner;
      this.values = new ValueReader(scanner);
    }

    /**
     * Reads statements into {@code target} until its terminator: {@code END} at the top level, the
     * block's close keyword inside a block.
     */
    void statements(Statements target, StatementKind block, Identifier blockName)
        throws LabelParseException {
      while (true) {
        skip(scanner);
        long start = scanner.position();
        if (scanner.eof()) {
          throw new UnexpectedEndException(
              block == null
                  ? "Label ended without END"
                  : String.format("%s '%s' is not closed", block.openKeyword(), blockName),
              start);
        }
        String word = scanner.peek() == '^' ? "" : scanner.readWord();
        switch (word.toUpperCase(Locale.ROOT)) {
          case "END":
            if (block != null) {
              throw new MismatchedBlockException(
                  String.format("END inside %s '%s'", block.openKeyword(), blockName), start, word);
            }
            return;
          case "GROUP":
          case "BEGIN_GROUP":
            if (block == StatementKind.GROUP) {
              throw new ExpectedTokenException("attribute in GROUP '" + blockName + "'", start, word);
            }
            target.append(group(start));
            break;
          case "OBJECT":
          case "BEGIN_OBJECT":
            if (block == StatementKind.GROUP) {
              throw new ExpectedTokenException("attribute in GROUP '" + blockName + "'", start, word);
            }
            target.append(object(start));
            break;
          case "END_GROUP":
          case "END_OBJECT":
            if (block == null || !block.closeKeyword().equalsIgnoreCase(word)) {
              throw new MismatchedBlockException(
                  block == null
                      ? word + " without an open block"
                      : String.format(
                          "%s '%s' closed by %s", block.openKeyword(), blockName, word),
                  start,
                  word);
            }
            closingName(blockName);
            return;
          default:
            scanner.position(start);
            target.append(attribute());
        }
      }
    }

    private GroupStatement group(long start) throws LabelParseException {
      Identifier name = blockName("group name");
      log.trace("GROUP {} at offset {}", name, start);
      GroupStatements body = new GroupStatements();
      statements(body, StatementKind.GROUP, name);
      return new GroupStatement(name, body);
    }

    private ObjectStatement object(long start) throws LabelParseException {
      Identifier name = blockName("object name");
      log.trace("OBJECT {} at offset {}", name, start);
      ObjectStatements body = new ObjectStatements();
      statements(body, StatementKind.OBJECT, name);
      return new ObjectStatement(name, body);
    }

    /** '=' name, after an opening keyword */
    private Identifier blockName(String what) throws LabelParseException {
      expectEquals();
      skip(scanner);
      long start = scanner.position();
      String name = scanner.readWord();
      if (name.isEmpty()) {
        throw unexpected(scanner, what);
      }
      try {
        return Identifier.plain(name);
      } catch (LabelValidationException e) {
        throw MalformedLiteralException.invalidValue(e, start, name);
      }
    }

    /** ['=' name], after a closing keyword; the name has to repeat the opening one */
    private void closingName(Identifier opened) throws LabelParseException {
      skip(scanner);
      if (!scanner.match('=')) {
        return;
      }
      skip(scanner);
      long start = scanner.position();
      String name = scanner.readWord();
      if (name.isEmpty()) {
        throw unexpected(scanner, "block name");
      }
      if (!opened.matches(name)) {
        throw MismatchedBlockException.nameMismatch(opened, name, start);
      }
    }

    private AttributeStatement attribute() throws LabelParseException {
      Identifier identifier = attributeIdentifier();
      expectEquals();
      Value value = values.readValue();
      log.trace("{} = {}", identifier, value);
      return new AttributeStatement(identifier, value);
    }

    private Identifier attributeIdentifier() throws LabelParseException {
      long start = scanner.position();
      boolean pointer = scanner.match('^');
      if (pointer) {
        skip(scanner);
      }
      String name = scanner.readWord();
      if (name.isEmpty()) {
        throw unexpected(scanner, "attribute identifier");
      }
      StringBuilder text = new StringBuilder(pointer ? "^" : "");
      text.append(name);
      skip(scanner);
      if (scanner.match(':')) {
        skip(scanner);
        String local = scanner.readWord();
        if (local.isEmpty()) {
          throw unexpected(scanner, "identifier after ':'");
        }
        text.append(':').append(local);
      }
      try {
        return Identifier.of(text.toString());
      } catch (LabelValidationException e) {
        throw MalformedLiteralException.invalidValue(e, start, text.toString());
      }
    }

    private void expectEquals() throws LabelParseException {
      skip(scanner);
      if (!scanner.match('=')) {
        throw unexpected(scanner, "'='");
      }
    }
  }

  /** Skips insignificant input, rejecting a comment that does not close on its line. */
  static void skip(LabelScanner scanner) throws MalformedLiteralException {
    if (scanner.skipInsignificant()) {
      long at = scanner.position();
      throw new MalformedLiteralException("Unterminated comment", at, scanner.text(at, at + 2));
    }
  }

  /** Builds the error for an unexpected byte, or for the end of input, at the cursor. */
  static LabelParseException unexpected(LabelScanner scanner, String expected) {
    long pos = scanner.position();
    int c = scanner.peek();
    if (c == LabelScanner.EOF) {
      return new UnexpectedEndException("Expected " + expected + " before end of input", pos);
    }
    if (!AsciiChars.isAscii(c)) {
      return nonAscii(scanner, c, pos);
    }
    return new ExpectedTokenException(expected, pos, scanner.lexemeAt(pos));
  }

  static MalformedLiteralException nonAscii(LabelScanner scanner, int c, long at) {
    String what = "non-ASCII byte " + AsciiChars.describe(c);
    return new MalformedLiteralException(
        Character.toUpperCase(what.charAt(0)) + what.substring(1),
        new LabelValidationException(what),
        at,
        AsciiChars.describe(c));
  }
}
