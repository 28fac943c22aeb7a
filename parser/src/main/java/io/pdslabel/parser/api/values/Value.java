package io.pdslabel.parser.api.values;

/**
 * A value on the right-hand side of an attribute assignment.
 *
 * <p>The variant set is closed: a value is a {@link Scalar}, a {@link SetValue}, a {@link
 * Sequence1D} or a {@link Sequence2D}. Scalars are immutable; the composite values are mutable
 * containers that are exclusively owned by the attribute holding them (use {@link #copy()} to
 * obtain an independent instance).
 */
public sealed interface Value permits Scalar, SetValue, Sequence1D, Sequence2D {

  /**
   * Returns an independent copy of this value. Scalars are immutable and return themselves.
   *
   * @return a deep copy
   */
  Value copy();
}
