package io.pdslabel.parser.api.values;

import io.pdslabel.parser.api.LabelValidationException;
import io.pdslabel.utils.AsciiChars;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Integer written in an explicit radix, e.g. {@code 16#4B#} or {@code 2#-1001011#}.
 *
 * <p>The radix and the digit string are kept exactly as written, including digit case and sign,
 * so the value renders back the way it was read. The decimal value is derived once, here.
 */
public final class BasedIntegerValue implements Numeric {
  private final int radix;
  private final String digits;
  private final Units units;
  private final BigInteger value;

  /**
   * Creates a based integer.
   *
   * @param radix the radix, 2 to 16
   * @param digits the digits, optionally signed, valid for {@code radix}
   * @param units the units, or {@code null}
   * @throws LabelValidationException if the radix is out of range or a digit is not valid for it
   */
  public BasedIntegerValue(int radix, String digits, Units units) {
    if (radix < 2 || radix > 16) {
      throw LabelValidationException.outOfRange("radix", radix, 2, 16);
    }
    if (digits == null) {
      throw LabelValidationException.invalid("based integer digits", null);
    }
    int start = digits.startsWith("+") || digits.startsWith("-") ? 1 : 0;
    if (start == digits.length()) {
      throw LabelValidationException.invalid("based integer digits", digits);
    }
    for (int i = start; i < digits.length(); i++) {
      if (AsciiChars.digitValue(digits.charAt(i), radix) < 0) {
        throw new LabelValidationException(
            String.format("digit '%s' is not valid in radix %d", digits.charAt(i), radix),
            digits);
      }
    }
    this.radix = radix;
    this.digits = digits;
    this.units = units;
    this.value = new BigInteger(digits, radix);
  }

  public BasedIntegerValue(int radix, String digits) {
    this(radix, digits, null);
  }

  public int radix() {
    return radix;
  }

  /**
   * Gets the digits as written.
   *
   * @return the digit string, with sign if one was given
   */
  public String digits() {
    return digits;
  }

  @Override
  public Units units() {
    return units;
  }

  /**
   * Gets the value in base 10.
   *
   * @return the derived value
   */
  public BigInteger value() {
    return value;
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
    return withUnits(radix + "#" + digits + "#");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof BasedIntegerValue)) return false;
    BasedIntegerValue that = (BasedIntegerValue) o;
    return radix == that.radix && digits.equals(that.digits) && Objects.equals(units, that.units);
  }

  @Override
  public int hashCode() {
    return Objects.hash(radix, digits, units);
  }

  @Override
  public String toString() {
    return toLabelString();
  }
}
