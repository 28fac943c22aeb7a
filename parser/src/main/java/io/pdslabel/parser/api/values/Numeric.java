package io.pdslabel.parser.api.values;

import java.math.BigInteger;

/** Numeric scalar with optional {@link Units}. */
public sealed interface Numeric extends Scalar permits IntegerValue, BasedIntegerValue, RealValue {

  /**
   * Gets the units annotation.
   *
   * @return the units, or {@code null} if the value is unit-less
   */
  Units units();

  /**
   * Returns the value as an integer. Reals are truncated toward zero.
   *
   * @return the integral value
   */
  BigInteger bigIntegerValue();

  /**
   * Returns the value as a {@code long}.
   *
   * @return the value, truncated toward zero for reals
   * @throws ArithmeticException if the integral value does not fit into a {@code long}
   */
  default long longValue() {
    return bigIntegerValue().longValueExact();
  }

  /**
   * Returns the value as a {@code double}.
   *
   * @return the value, possibly rounded
   */
  double doubleValue();

  /**
   * Appends {@code " <UNITS>"} if there are units.
   *
   * @param number the rendered number
   * @return the full label text
   */
  default String withUnits(String number) {
    return units() == null ? number : number + " " + units().toLabelString();
  }
}
