package io.pdslabel.parser.api;

import io.pdslabel.parser.api.statements.Label;
import io.pdslabel.parser.impl.LabelParserImpl;
import io.pdslabel.utils.ByteSource;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;

/**
 * Parses ODL/PVL label text into a {@link Label} tree.
 *
 * <p>The input must start with a label; bytes following its {@code END} statement are neither read
 * nor validated, so a label prefixed to binary data can be parsed straight from the mapped file.
 *
 * <p>A parser holds no state between calls. Each call either returns a complete label or throws a
 * {@link LabelParseException}.
 */
public interface LabelParser {
  /**
   * Creates a parser.
   *
   * @return a new parser instance
   */
  static LabelParser create() {
    return new LabelParserImpl();
  }

  /**
   * Parses a label from a byte array.
   *
   * @param bytes the label bytes
   * @return the parsed label
   * @throws LabelParseException if the bytes do not start with a valid label
   */
  static Label parse(byte[] bytes) throws LabelParseException {
    return create().parse(ByteSource.wrap(bytes));
  }

  /**
   * Parses a label from the remaining bytes of a buffer. The buffer's position is not changed.
   *
   * @param buffer the label bytes
   * @return the parsed label
   * @throws LabelParseException if the buffer does not start with a valid label
   */
  static Label parse(ByteBuffer buffer) throws LabelParseException {
    return create().parse(ByteSource.wrap(buffer));
  }

  /**
   * Parses the label at the start of a file. The file is memory-mapped rather than read.
   *
   * @param path the file
   * @return the parsed label
   * @throws IOException if the file cannot be mapped
   * @throws LabelParseException if the file does not start with a valid label
   */
  static Label parse(Path path) throws IOException, LabelParseException {
    return create().parse(ByteSource.map(path));
  }

  /**
   * Parses a label.
   *
   * @param source the input
   * @return the parsed label
   * @throws LabelParseException if the input does not start with a valid label
   */
  Label parse(ByteSource source) throws LabelParseException;
}
