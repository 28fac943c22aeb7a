package io.pdslabel.parser.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import io.pdslabel.parser.api.Identifier;
import io.pdslabel.parser.api.LabelParseException;
import io.pdslabel.parser.api.LabelParser;
import io.pdslabel.parser.api.statements.AttributeStatement;
import io.pdslabel.parser.api.statements.GroupStatement;
import io.pdslabel.parser.api.statements.Label;
import io.pdslabel.parser.api.statements.ObjectStatement;
import io.pdslabel.parser.api.statements.StatementKind;
import io.pdslabel.parser.api.values.BasedIntegerValue;
import io.pdslabel.parser.api.values.DateTimeValue;
import io.pdslabel.parser.api.values.DateValue;
import io.pdslabel.parser.api.values.IdentifierValue;
import io.pdslabel.parser.api.values.IntegerValue;
import io.pdslabel.parser.api.values.RealValue;
import io.pdslabel.parser.api.values.Sequence1D;
import io.pdslabel.parser.api.values.Sequence2D;
import io.pdslabel.parser.api.values.SetValue;
import io.pdslabel.parser.api.values.SymbolValue;
import io.pdslabel.parser.api.values.TextValue;
import io.pdslabel.parser.api.values.TimeValue;
import io.pdslabel.parser.api.values.Units;
import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LabelParserTest {

  @TempDir Path tempDir;

  static Label parse(String text) throws LabelParseException {
    return LabelParser.parse(text.getBytes(StandardCharsets.US_ASCII));
  }

  @Test
  void parsesScalarLiterals() throws Exception {
    Label label =
        parse(
            "PDS_VERSION_ID = PDS3\r\n"
                + "COUNT = 42\r\n"
                + "NEG = -7\r\n"
                + "RATE = 2.5 <km/s>\r\n"
                + "SCALE = 1.5E-3\r\n"
                + "BASED = 16#4B#\r\n"
                + "TEXT = \"multi\r\n  line\"\r\n"
                + "SYM = 'n/a'\r\n"
                + "DATE = 2015-02-01\r\n"
                + "DOY = 2015-032\r\n"
                + "TIME = 12:30:05.5Z\r\n"
                + "ZONED = 08:00+05:30\r\n"
                + "STAMP = 2015-032T12:00:00\r\n"
                + "END\r\n");

    assertEquals(13, label.size());
    assertEquals(IdentifierValue.of("PDS3"), label.getValue("pds_version_id"));
    assertEquals(IntegerValue.of(42), label.getValue("COUNT"));
    assertEquals(IntegerValue.of(-7), label.getValue("NEG"));
    assertEquals(new RealValue(2.5, Units.of("KM/S")), label.getValue("RATE"));
    assertEquals(RealValue.of(0.0015), label.getValue("SCALE"));
    BasedIntegerValue based = (BasedIntegerValue) label.getValue("BASED");
    assertEquals(75, based.longValue());
    assertEquals("16#4B#", based.toLabelString());
    assertEquals(TextValue.of("multi\r\n  line"), label.getValue("TEXT"));
    assertEquals(SymbolValue.of("N/A"), label.getValue("SYM"));
    assertEquals(DateValue.ofMonthDay(2015, 2, 1), label.getValue("DATE"));
    assertEquals(DateValue.ofDayOfYear(2015, 32), label.getValue("DOY"));
    assertEquals(TimeValue.utc(12, 30, new BigDecimal("5.5")), label.getValue("TIME"));
    assertEquals(TimeValue.zoned(8, 0, null, 5, 30), label.getValue("ZONED"));
    assertEquals(
        new DateTimeValue(DateValue.ofDayOfYear(2015, 32), TimeValue.local(12, 0, BigDecimal.ZERO)),
        label.getValue("STAMP"));
  }

  @Test
  void parsesSequencesAndSets() throws Exception {
    Label label =
        parse(
            "SEQ = (1, 2.0, 'A')\n"
                + "NESTED = ((1, 2), (3, 4))\n"
                + "SET = {1, 'b', 1}\n"
                + "EMPTY_SET = {}\n"
                + "SPACED = ( 1 ,\n 2 )\n"
                + "END\n");

    assertEquals(
        new Sequence1D(IntegerValue.of(1), RealValue.of(2.0), SymbolValue.of("A")),
        label.getValue("SEQ"));
    assertEquals(
        new Sequence2D(
            new Sequence1D(IntegerValue.of(1), IntegerValue.of(2)),
            new Sequence1D(IntegerValue.of(3), IntegerValue.of(4))),
        label.getValue("NESTED"));
    assertEquals(new SetValue(IntegerValue.of(1), SymbolValue.of("B")), label.getValue("SET"));
    assertEquals(new SetValue(), label.getValue("EMPTY_SET"));
    assertEquals(new Sequence1D(IntegerValue.of(1), IntegerValue.of(2)), label.getValue("SPACED"));
  }

  @Test
  void parsesNestedBlocks() throws Exception {
    Label label =
        parse(
            "/* leading comment */\r\n"
                + "OBJECT = IMAGE\r\n"
                + "  LINES = 10 /* trailing comment */\r\n"
                + "  GROUP = STATS\r\n"
                + "    MEAN = 1.5\r\n"
                + "  END_GROUP = STATS\r\n"
                + "  OBJECT = SUB\r\n"
                + "  END_OBJECT\r\n"
                + "END_OBJECT = image\r\n"
                + "BEGIN_GROUP = g\r\n"
                + "  A = 1\r\n"
                + "end_group\r\n"
                + "BEGIN_OBJECT = o\r\n"
                + "END_OBJECT = O\r\n"
                + "END\r\n");

    assertEquals(3, label.size());
    ObjectStatement image = (ObjectStatement) label.get("IMAGE");
    assertEquals(3, image.statements().size());
    assertEquals(IntegerValue.of(10), image.statements().getValue("LINES"));
    GroupStatement stats = (GroupStatement) image.statements().get("STATS");
    assertEquals(RealValue.of(1.5), stats.statements().getValue("MEAN"));
    assertTrue(((ObjectStatement) image.statements().get("SUB")).statements().isEmpty());
    assertEquals(StatementKind.GROUP, label.get("G").kind());
    assertEquals(StatementKind.OBJECT, label.get(-1).kind());
  }

  @Test
  void parsesPointersAndNamespaces() throws Exception {
    Label label =
        parse("^IMAGE = 12\n^ TABLE = (\"DATA.TAB\", 5 <BYTES>)\nPDS : VERSION = 3\nEND\n");

    AttributeStatement pointer = (AttributeStatement) label.get(0);
    assertTrue(pointer.identifier().isPointer());
    assertEquals("^IMAGE", pointer.identifier().text());
    assertEquals(
        new Sequence1D(TextValue.of("DATA.TAB"), IntegerValue.of(5, Units.of("BYTES"))),
        label.getValue("^table"));
    assertEquals(Identifier.of("PDS:VERSION"), label.get(2).identifier());
  }

  @Test
  void keywordsAndSeparatorsAreCaseInsensitive() throws Exception {
    Label label = parse("object = x\n t = 2015-032t12:00z\nend_object = X\nend\n");
    ObjectStatement x = (ObjectStatement) label.get("X");
    DateTimeValue t = (DateTimeValue) x.statements().getValue("T");
    assertTrue(t.time().isUtc());
  }

  @Test
  void dropsWhitespaceInsideUnits() throws Exception {
    Label label = parse("V = 5 < km / s >\nEND");
    assertEquals(IntegerValue.of(5, Units.of("KM/S")), label.getValue("V"));
  }

  @Test
  void stopsAtEnd() throws Exception {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    bytes.writeBytes("A = 1\r\nEND\r\n".getBytes(StandardCharsets.US_ASCII));
    bytes.writeBytes(new byte[] {(byte) 0xFF, 0x00, (byte) 0xC3, '"'});

    Label label = LabelParser.parse(bytes.toByteArray());
    assertEquals(1, label.size());
  }

  @Test
  void parsesFromBufferAndMappedFile() throws Exception {
    byte[] text = "A = 1\r\nEND\r\n".getBytes(StandardCharsets.US_ASCII);
    ByteBuffer buffer = ByteBuffer.allocate(text.length + 3);
    buffer.put(new byte[] {9, 9, 9}).put(text).position(3);
    assertEquals(1, LabelParser.parse(buffer).size());
    assertEquals(3, buffer.position());

    Path file = tempDir.resolve("image.img");
    byte[] content = new byte[text.length + 256];
    System.arraycopy(text, 0, content, 0, text.length);
    for (int i = text.length; i < content.length; i++) {
      content[i] = (byte) i;
    }
    Files.write(file, content);
    Label label = LabelParser.parse(file);
    assertThat(label.getValue("A")).isEqualTo(IntegerValue.of(1));
  }
}
