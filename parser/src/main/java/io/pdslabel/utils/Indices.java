package io.pdslabel.utils;

/** Negative-index arithmetic shared by the label containers. */
public final class Indices {
  private Indices() {}

  /**
   * Resolves an element index; negative indices count from the end.
   *
   * @param index the index, {@code -size <= index < size}
   * @param size the container size
   * @return the non-negative index
   * @throws IndexOutOfBoundsException if the index is out of range
   */
  public static int element(int index, int size) {
    int resolved = index < 0 ? size + index : index;
    if (resolved < 0 || resolved >= size) {
      throw new IndexOutOfBoundsException(
          String.format("Index %d out of range for size %d", index, size));
    }
    return resolved;
  }

  /**
   * Resolves an insertion point; negative indices count from the end and {@code size} appends.
   *
   * @param index the index, {@code -size <= index <= size}
   * @param size the container size
   * @return the non-negative insertion point
   * @throws IndexOutOfBoundsException if the index is out of range
   */
  public static int insertion(int index, int size) {
    int resolved = index < 0 ? size + index : index;
    if (resolved < 0 || resolved > size) {
      throw new IndexOutOfBoundsException(
          String.format("Insertion index %d out of range for size %d", index, size));
    }
    return resolved;
  }
}
