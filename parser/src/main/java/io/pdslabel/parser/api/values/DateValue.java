package io.pdslabel.parser.api.values;

import io.pdslabel.parser.api.LabelValidationException;
import java.time.Year;
import java.time.YearMonth;
import java.util.OptionalInt;

/**
 * Calendar date in one of two forms: year-month-day ({@code 2015-02-01}) or year-day-of-year
 * ({@code 2015-032}).
 *
 * <p>In the day-of-year form {@link #month()} is empty and {@link #day()} is the day of the year.
 */
public final class DateValue implements Scalar {
  private static final int NO_MONTH = 0;

  private final int year;
  private final int month;
  private final int day;

  private DateValue(int year, int month, int day) {
    this.year = year;
    this.month = month;
    this.day = day;
  }

  /**
   * Creates a date.
   *
   * @param year the year, 0 to 9999
   * @param month the month, 1 to 12, or {@code null} for the day-of-year form
   * @param day the day of the month, or the day of the year if {@code month} is {@code null}
   * @return the date
   * @throws LabelValidationException if the date does not exist
   */
  public static DateValue of(int year, Integer month, int day) {
    if (year < 0 || year > 9999) {
      throw LabelValidationException.outOfRange("year", year, 0, 9999);
    }
    if (month == null) {
      int max = Year.of(year).length();
      if (day < 1 || day > max) {
        throw LabelValidationException.outOfRange("day of year", day, 1, max);
      }
      return new DateValue(year, NO_MONTH, day);
    }
    if (month < 1 || month > 12) {
      throw LabelValidationException.outOfRange("month", month, 1, 12);
    }
    int max = YearMonth.of(year, month).lengthOfMonth();
    if (day < 1 || day > max) {
      throw LabelValidationException.outOfRange("day", day, 1, max);
    }
    return new DateValue(year, month, day);
  }

  /** Creates a year-month-day date. */
  public static DateValue ofMonthDay(int year, int month, int day) {
    return of(year, month, day);
  }

  /** Creates a year-day-of-year date. */
  public static DateValue ofDayOfYear(int year, int dayOfYear) {
    return of(year, null, dayOfYear);
  }

  public int year() {
    return year;
  }

  /**
   * Gets the month.
   *
   * @return the month, or empty in the day-of-year form
   */
  public OptionalInt month() {
    return month == NO_MONTH ? OptionalInt.empty() : OptionalInt.of(month);
  }

  /**
   * Gets the day.
   *
   * @return the day of the month, or the day of the year if {@link #isDayOfYear()}
   */
  public int day() {
    return day;
  }

  public boolean isDayOfYear() {
    return month == NO_MONTH;
  }

  @Override
  public String toLabelString() {
    return isDayOfYear()
        ? String.format("%04d-%03d", year, day)
        : String.format("%04d-%02d-%02d", year, month, day);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof DateValue)) return false;
    DateValue that = (DateValue) o;
    return year == that.year && month == that.month && day == that.day;
  }

  @Override
  public int hashCode() {
    return (year * 31 + month) * 31 + day;
  }

  @Override
  public String toString() {
    return toLabelString();
  }
}
