package io.pdslabel.parser.api.values;

import io.pdslabel.parser.api.LabelValidationException;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Floating point value.
 *
 * <p>Rendered with {@link Double#toString(double)}, which always carries a fractional part and
 * falls back to {@code E} notation for very large and very small magnitudes; both forms are valid
 * real literals.
 *
 * @param value the value, finite
 * @param units the units, or {@code null}
 */
public record RealValue(double value, Units units) implements Numeric {

  public RealValue {
    if (!Double.isFinite(value)) {
      throw new LabelValidationException("real value must be finite", String.valueOf(value));
    }
  }

  public static RealValue of(double value) {
    return new RealValue(value, null);
  }

  /**
   * Parses a real literal: optional sign, digits with an optional leading or trailing fractional
   * dot, optional exponent. {@code 1.}, {@code .5}, {@code -2.5E-3} and {@code 1e9} are all
   * accepted.
   *
   * @param text the literal
   * @param units the units, or {@code null}
   * @return the real
   * @throws LabelValidationException if {@code text} is not a real literal
   */
  public static RealValue parse(String text, Units units) {
    if (text == null || !text.matches("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?")) {
      throw LabelValidationException.invalid("real", text);
    }
    return new RealValue(Double.parseDouble(text), units);
  }

  @Override
  public BigInteger bigIntegerValue() {
    return BigDecimal.valueOf(value).toBigInteger();
  }

  @Override
  public double doubleValue() {
    return value;
  }

  @Override
  public String toLabelString() {
    return withUnits(Double.toString(value));
  }

  @Override
  public String toString() {
    return toLabelString();
  }
}
