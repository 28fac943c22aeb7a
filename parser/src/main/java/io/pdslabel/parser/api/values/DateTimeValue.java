package io.pdslabel.parser.api.values;

import io.pdslabel.parser.api.LabelValidationException;

/**
 * Date and time joined by {@code T}, e.g. {@code 2015-032T12:30:05.25Z}.
 *
 * @param date the date part
 * @param time the time part
 */
public record DateTimeValue(DateValue date, TimeValue time) implements Scalar {

  public DateTimeValue {
    if (date == null || time == null) {
      throw new LabelValidationException("date-time needs both a date and a time");
    }
  }

  @Override
  public String toLabelString() {
    return date.toLabelString() + "T" + time.toLabelString();
  }

  @Override
  public String toString() {
    return toLabelString();
  }
}
