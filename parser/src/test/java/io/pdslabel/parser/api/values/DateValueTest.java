package io.pdslabel.parser.api.values;

import static org.junit.jupiter.api.Assertions.*;

import io.pdslabel.parser.api.LabelValidationException;
import org.junit.jupiter.api.Test;

class DateValueTest {

  @Test
  void dayOfYearFormHasNoMonth() {
    DateValue date = DateValue.of(2015, null, 32);
    assertTrue(date.month().isEmpty());
    assertTrue(date.isDayOfYear());
    assertEquals(32, date.day());
    assertEquals("2015-032", date.toLabelString());
  }

  @Test
  void rendersYearMonthDay() {
    DateValue date = DateValue.ofMonthDay(987, 2, 1);
    assertEquals(2, date.month().getAsInt());
    assertEquals("0987-02-01", date.toLabelString());
  }

  @Test
  void validatesCalendar() {
    assertDoesNotThrow(() -> DateValue.ofMonthDay(2000, 2, 29));
    assertDoesNotThrow(() -> DateValue.ofDayOfYear(2016, 366));
    assertThrows(LabelValidationException.class, () -> DateValue.ofMonthDay(1900, 2, 29));
    assertThrows(LabelValidationException.class, () -> DateValue.ofMonthDay(2015, 13, 1));
    assertThrows(LabelValidationException.class, () -> DateValue.ofMonthDay(2015, 4, 31));
    assertThrows(LabelValidationException.class, () -> DateValue.ofDayOfYear(2015, 366));
    assertThrows(LabelValidationException.class, () -> DateValue.ofDayOfYear(2015, 0));
    assertThrows(LabelValidationException.class, () -> DateValue.ofDayOfYear(10000, 1));
  }

  @Test
  void formsAreDistinct() {
    assertNotEquals(DateValue.ofDayOfYear(2015, 32), DateValue.ofMonthDay(2015, 2, 1));
    assertEquals(DateValue.ofMonthDay(2015, 2, 1), DateValue.of(2015, 2, 1));
  }
}
