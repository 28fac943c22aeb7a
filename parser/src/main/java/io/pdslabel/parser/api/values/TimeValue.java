package io.pdslabel.parser.api.values;

import io.pdslabel.parser.api.LabelValidationException;
import java.math.BigDecimal;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Time of day: hour, minute and optional (possibly fractional) second, in exactly one of three
 * zones: local, UTC ({@code Z} suffix) or a fixed offset ({@code +HH[:MM]}/{@code -HH[:MM]}).
 *
 * <p>The UTC flag takes precedence: when it is set, zone offset arguments are dropped and read back
 * as empty.
 */
public final class TimeValue implements Scalar {
  private static final BigDecimal SIXTY = BigDecimal.valueOf(60);

  private final int hour;
  private final int minute;
  private final BigDecimal second;
  private final boolean utc;
  private final Integer zoneHour;
  private final Integer zoneMinute;

  private TimeValue(
      int hour, int minute, BigDecimal second, boolean utc, Integer zoneHour, Integer zoneMinute) {
    this.hour = hour;
    this.minute = minute;
    this.second = second;
    this.utc = utc;
    this.zoneHour = zoneHour;
    this.zoneMinute = zoneMinute;
  }

  /**
   * Creates a time.
   *
   * @param hour 0 to 23
   * @param minute 0 to 59
   * @param second 0 (inclusive) to 60 (exclusive), or {@code null}
   * @param utc whether the time is UTC; if set, the zone arguments are ignored
   * @param zoneHour -12 to 12, or {@code null} for local time
   * @param zoneMinute 0 to 59, or {@code null}; only meaningful with {@code zoneHour}
   * @return the time
   * @throws LabelValidationException if a field is out of range
   */
  public static TimeValue of(
      int hour,
      int minute,
      BigDecimal second,
      boolean utc,
      Integer zoneHour,
      Integer zoneMinute) {
    if (hour < 0 || hour > 23) {
      throw LabelValidationException.outOfRange("hour", hour, 0, 23);
    }
    if (minute < 0 || minute > 59) {
      throw LabelValidationException.outOfRange("minute", minute, 0, 59);
    }
    if (second != null && (second.signum() < 0 || second.compareTo(SIXTY) >= 0)) {
      throw LabelValidationException.outOfRange("second", second.toPlainString(), 0, "59.999...");
    }
    if (utc) {
      return new TimeValue(hour, minute, second, true, null, null);
    }
    if (zoneHour == null) {
      if (zoneMinute != null) {
        throw new LabelValidationException("zone minute given without zone hour");
      }
      return new TimeValue(hour, minute, second, false, null, null);
    }
    if (zoneHour < -12 || zoneHour > 12) {
      throw LabelValidationException.outOfRange("zone hour", zoneHour, -12, 12);
    }
    if (zoneMinute != null && (zoneMinute < 0 || zoneMinute > 59)) {
      throw LabelValidationException.outOfRange("zone minute", zoneMinute, 0, 59);
    }
    return new TimeValue(hour, minute, second, false, zoneHour, zoneMinute);
  }

  public static TimeValue local(int hour, int minute, BigDecimal second) {
    return of(hour, minute, second, false, null, null);
  }

  public static TimeValue utc(int hour, int minute, BigDecimal second) {
    return of(hour, minute, second, true, null, null);
  }

  public static TimeValue zoned(
      int hour, int minute, BigDecimal second, int zoneHour, Integer zoneMinute) {
    return of(hour, minute, second, false, zoneHour, zoneMinute);
  }

  public int hour() {
    return hour;
  }

  public int minute() {
    return minute;
  }

  /**
   * Gets the seconds.
   *
   * @return the seconds, or {@code null} if the time has minute precision
   */
  public BigDecimal second() {
    return second;
  }

  public boolean isUtc() {
    return utc;
  }

  /** Whether the time has neither UTC flag nor zone offset. */
  public boolean isLocal() {
    return !utc && zoneHour == null;
  }

  public OptionalInt zoneHour() {
    return zoneHour == null ? OptionalInt.empty() : OptionalInt.of(zoneHour);
  }

  public OptionalInt zoneMinute() {
    return zoneMinute == null ? OptionalInt.empty() : OptionalInt.of(zoneMinute);
  }

  @Override
  public String toLabelString() {
    StringBuilder sb = new StringBuilder(String.format("%02d:%02d", hour, minute));
    if (second != null) {
      String s = second.stripTrailingZeros().toPlainString();
      int dot = s.indexOf('.');
      int intDigits = dot < 0 ? s.length() : dot;
      sb.append(':');
      if (intDigits < 2) {
        sb.append('0');
      }
      sb.append(s);
    }
    if (utc) {
      sb.append('Z');
    } else if (zoneHour != null) {
      sb.append(zoneHour < 0 ? '-' : '+').append(String.format("%02d", Math.abs(zoneHour)));
      if (zoneMinute != null) {
        sb.append(':').append(String.format("%02d", zoneMinute));
      }
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TimeValue)) return false;
    TimeValue that = (TimeValue) o;
    return hour == that.hour
        && minute == that.minute
        && utc == that.utc
        && (second == null ? that.second == null : that.second != null
            && second.compareTo(that.second) == 0)
        && Objects.equals(zoneHour, that.zoneHour)
        && Objects.equals(zoneMinute, that.zoneMinute);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        hour,
        minute,
        second == null ? null : second.stripTrailingZeros(),
        utc,
        zoneHour,
        zoneMinute);
  }

  @Override
  public String toString() {
    return toLabelString();
  }
}
