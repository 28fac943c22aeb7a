package io.pdslabel.utils;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Random-access view over the bytes a label is read from.
 *
 * <p>The parser only ever asks for single bytes by absolute index and for short ASCII slices, so a
 * source may be backed by a heap array, a direct buffer or a memory-mapped file without the whole
 * input being copied up front.
 */
public interface ByteSource {
  /**
   * Wraps a byte array. The array is not copied.
   *
   * @param bytes the backing array
   * @return a byte source over the whole array
   */
  static ByteSource wrap(byte[] bytes) {
    return wrap(bytes, 0, bytes.length);
  }

  /**
   * Wraps a region of a byte array. The array is not copied.
   *
   * @param bytes the backing array
   * @param offset the first byte of the region
   * @param length the region length
   * @return a byte source over the region
   * @throws IndexOutOfBoundsException if the region does not fit into the array
   */
  static ByteSource wrap(byte[] bytes, int offset, int length) {
    Objects.checkFromIndexSize(offset, length, bytes.length);
    return new ByteBufferSource(ByteBuffer.wrap(bytes, offset, length).slice());
  }

  /**
   * Wraps the remaining bytes of a buffer. The buffer position is not modified.
   *
   * @param buffer the backing buffer
   * @return a byte source over {@code buffer.position()} to {@code buffer.limit()}
   */
  static ByteSource wrap(ByteBuffer buffer) {
    return new ByteBufferSource(buffer.slice());
  }

  /**
   * Maps a file read-only into memory.
   *
   * <p>Labels sit in front of their data, so only the first {@link Integer#MAX_VALUE} bytes of
   * larger files are mapped.
   *
   * @param path the file to map
   * @return a byte source over the mapped region
   * @throws IOException if the file cannot be opened or mapped
   */
  static ByteSource map(Path path) throws IOException {
    long size = Math.min(Files.size(path), Integer.MAX_VALUE);
    try (RandomAccessFile raf = new RandomAccessFile(path.toFile(), "r");
        FileChannel channel = raf.getChannel()) {
      return new ByteBufferSource(channel.map(FileChannel.MapMode.READ_ONLY, 0, size));
    }
  }

  /**
   * Gets the number of addressable bytes.
   *
   * @return the length of this source
   */
  long length();

  /**
   * Reads a single byte.
   *
   * @param index the absolute index, {@code 0 <= index < length()}
   * @return the byte value
   * @throws IndexOutOfBoundsException if the index is out of range
   */
  byte get(long index);

  /**
   * Copies a region and decodes it as US-ASCII.
   *
   * @param from the first index, inclusive
   * @param to the last index, exclusive
   * @return the decoded region
   * @throws IndexOutOfBoundsException if the region is out of range
   */
  String ascii(long from, long to);

  /**
   * {@link ByteSource} backed by a {@link ByteBuffer}.
   *
   * <p>All reads are absolute, so the wrapped buffer's position and mark are never touched.
   */
  final class ByteBufferSource implements ByteSource {
    private final ByteBuffer delegate;

    /**
     * Constructs a new ByteBufferSource over the whole capacity-limited window of the buffer.
     *
     * @param delegate the buffer to read from, starting at index 0
     */
    public ByteBufferSource(ByteBuffer delegate) {
      this.delegate = delegate;
    }

    @Override
    public long length() {
      return delegate.limit();
    }

    @Override
    public byte get(long index) {
      Objects.checkIndex(index, length());
      return delegate.get((int) index);
    }

    @Override
    public String ascii(long from, long to) {
      Objects.checkFromToIndex(from, to, length());
      byte[] bytes = new byte[(int) (to - from)];
      for (int i = 0; i < bytes.length; i++) {
        bytes[i] = delegate.get((int) from + i);
      }
      return new String(bytes, StandardCharsets.US_ASCII);
    }
  }
}
