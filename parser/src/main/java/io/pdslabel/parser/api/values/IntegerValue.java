package io.pdslabel.parser.api.values;

import io.pdslabel.parser.api.LabelValidationException;
import java.math.BigInteger;

/**
 * Arbitrary-precision decimal integer.
 *
 * @param value the value
 * @param units the units, or {@code null}
 */
public record IntegerValue(BigInteger value, Units units) implements Numeric {

  public IntegerValue {
    if (value == null) {
      throw new LabelValidationException("integer value must not be null");
    }
  }

  public static IntegerValue of(long value) {
    return new IntegerValue(BigInteger.valueOf(value), null);
  }

  public static IntegerValue of(long value, Units units) {
    return new IntegerValue(BigInteger.valueOf(value), units);
  }

  /**
   * Parses a decimal integer literal with optional sign.
   *
   * @param text the literal, e.g. {@code -42}
   * @param units the units, or {@code null}
   * @return the integer
   * @throws LabelValidationException if {@code text} is not a decimal integer
   */
  public static IntegerValue parse(String text, Units units) {
    try {
      return new IntegerValue(new BigInteger(text), units);
    } catch (NumberFormatException | NullPointerException e) {
      throw LabelValidationException.invalid("integer", text);
    }
  }

  @Override
  public BigInteger bigIntegerValue() {
    return value;
  }

  @Override
  public double doubleValue() {
    return value.doubleValue();
  }

  @Override
  public String toLabelString() {
    return withUnits(value.toString());
  }

  @Override
  public String toString() {
    return toLabelString();
  }
}
