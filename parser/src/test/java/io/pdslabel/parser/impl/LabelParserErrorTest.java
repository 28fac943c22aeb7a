package io.pdslabel.parser.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pdslabel.parser.api.ExpectedTokenException;
import io.pdslabel.parser.api.LabelParseException;
import io.pdslabel.parser.api.LabelParser;
import io.pdslabel.parser.api.LabelValidationException;
import io.pdslabel.parser.api.MalformedLiteralException;
import io.pdslabel.parser.api.MismatchedBlockException;
import io.pdslabel.parser.api.UnexpectedEndException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class LabelParserErrorTest {

  private static LabelParseException failure(String text) {
    return failure(text.getBytes(StandardCharsets.ISO_8859_1));
  }

  private static LabelParseException failure(byte[] bytes) {
    try {
      LabelParser.parse(bytes);
    } catch (LabelParseException e) {
      return e;
    }
    throw new AssertionError("label parsed without error");
  }

  @Test
  void emptyInputIsUnexpectedEnd() {
    assertThat(failure("")).isInstanceOf(UnexpectedEndException.class);
    assertThat(failure("  /* only a comment */ \r\n")).isInstanceOf(UnexpectedEndException.class);
  }

  @Test
  void missingEqualsNamesTheToken() {
    LabelParseException e = failure("blha blha blha");
    assertThat(e).isInstanceOf(ExpectedTokenException.class);
    assertThat(e.getContext()).isEqualTo("blha");
    assertThat(e.position()).isEqualTo(5);
    assertThat(e.getErrorCode()).isEqualTo("EXPECTED_TOKEN");
    assertThat(e).hasMessageStartingWith("Expected '=' instead of 'blha'");
  }

  @Test
  void missingEndIsUnexpectedEnd() {
    assertThat(failure("A = 1\r\n")).isInstanceOf(UnexpectedEndException.class);
    assertThat(failure("A =")).isInstanceOf(UnexpectedEndException.class);
    assertThat(failure("GROUP = A\r\nX = 1\r\n")).isInstanceOf(UnexpectedEndException.class);
  }

  @Test
  void blockTerminatorsMustMatch() {
    LabelParseException renamed = failure("OBJECT = A\r\nEND_OBJECT = B\r\nEND");
    assertThat(renamed).isInstanceOf(MismatchedBlockException.class);
    assertThat(renamed.getContext()).isEqualTo("B");

    assertThat(failure("OBJECT = A\r\nEND_GROUP = A\r\nEND"))
        .isInstanceOf(MismatchedBlockException.class);
    assertThat(failure("GROUP = A\r\nEND\r\n")).isInstanceOf(MismatchedBlockException.class);
    assertThat(failure("END_GROUP = A\r\nEND")).isInstanceOf(MismatchedBlockException.class);
  }

  @Test
  void groupsCannotNestBlocks() {
    LabelParseException e =
        failure("GROUP = A\r\nOBJECT = B\r\nEND_OBJECT\r\nEND_GROUP\r\nEND\r\n");
    assertThat(e).isInstanceOf(ExpectedTokenException.class);
    assertThat(e.getContext()).isEqualTo("OBJECT");
  }

  @Test
  void invalidLiteralsCarryValidationCause() {
    LabelParseException radix = failure("A = 2#102#\r\nEND");
    assertThat(radix).isInstanceOf(MalformedLiteralException.class);
    assertThat(radix.getCause()).isInstanceOf(LabelValidationException.class);
    assertThat(radix.getContext()).isEqualTo("2#102#");
    assertThat(radix.position()).isEqualTo(4);

    assertThat(failure("A = 2015-400\r\nEND")).isInstanceOf(MalformedLiteralException.class);
    assertThat(failure("A = 25:00\r\nEND")).isInstanceOf(MalformedLiteralException.class);
    assertThat(failure("A = 5 <KM//S>\r\nEND")).isInstanceOf(MalformedLiteralException.class);
    assertThat(failure("A = 17#1#\r\nEND")).isInstanceOf(MalformedLiteralException.class);
    assertThat(failure("A__B = 1\r\nEND")).isInstanceOf(MalformedLiteralException.class);
    assertThat(failure("^PDS:IMAGE = 1\r\nEND")).isInstanceOf(MalformedLiteralException.class);
    assertThat(failure("A = ''\r\nEND")).isInstanceOf(MalformedLiteralException.class);
  }

  @Test
  void unterminatedLiteralsAreMalformed() {
    assertThat(failure("A = \"abc\r\nEND")).isInstanceOf(MalformedLiteralException.class);
    assertThat(failure("A = 'abc")).isInstanceOf(MalformedLiteralException.class);
    assertThat(failure("A = 16#4B\r\nEND")).isInstanceOf(MalformedLiteralException.class);
    assertThat(failure("/* open\r\nEND")).isInstanceOf(MalformedLiteralException.class);
  }

  @Test
  void nonAsciiIsRejected() {
    LabelParseException inText = failure("A = \"café\"\r\nEND");
    assertThat(inText).isInstanceOf(MalformedLiteralException.class);
    assertThat(inText.getCause()).isInstanceOf(LabelValidationException.class);
    assertThat(inText.getContext()).isEqualTo("0xE9");

    assertThat(failure(new byte[] {(byte) 0xC3, '=', '1'}))
        .isInstanceOf(MalformedLiteralException.class);
  }

  @Test
  void emptySequencesAndBadSetMembersAreRejected() {
    assertThat(failure("A = ()\r\nEND")).isInstanceOf(ExpectedTokenException.class);
    assertThat(failure("A = (1, )\r\nEND")).isInstanceOf(ExpectedTokenException.class);
    assertThat(failure("A = (1 2)\r\nEND")).isInstanceOf(ExpectedTokenException.class);
    assertThat(failure("A = {\"x\"}\r\nEND")).isInstanceOf(MalformedLiteralException.class);
    assertThat(failure("A = {1.5}\r\nEND")).isInstanceOf(MalformedLiteralException.class);
  }

  @Test
  void messagesFollowTheSharedFormat() {
    assertThatThrownBy(() -> LabelParser.parse(new byte[0]))
        .hasMessageContaining("[Error Code: UNEXPECTED_END]");
    assertThatThrownBy(
            () -> LabelParser.parse("A = 2#3#\nEND".getBytes(StandardCharsets.US_ASCII)))
        .hasMessageContaining("[Context: 2#3#]")
        .hasMessageContaining("[Error Code: MALFORMED_LITERAL]");
  }
}
