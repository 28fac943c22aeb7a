package io.pdslabel.parser.api.values;

import static org.junit.jupiter.api.Assertions.*;

import io.pdslabel.parser.api.LabelValidationException;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class TimeValueTest {

  @Test
  void utcFlagTakesPrecedenceOverZone() {
    TimeValue time = TimeValue.of(12, 30, null, true, 5, 30);
    assertTrue(time.isUtc());
    assertTrue(time.zoneHour().isEmpty());
    assertTrue(time.zoneMinute().isEmpty());
    assertEquals("12:30Z", time.toLabelString());
  }

  @Test
  void rendersSecondsAndZone() {
    assertEquals("01:02", TimeValue.local(1, 2, null).toLabelString());
    assertEquals("01:02:03", TimeValue.local(1, 2, new BigDecimal("3")).toLabelString());
    assertEquals("01:02:03.25", TimeValue.local(1, 2, new BigDecimal("3.250")).toLabelString());
    assertEquals("23:59:00-07", TimeValue.zoned(23, 59, BigDecimal.ZERO, -7, null).toLabelString());
    assertEquals("08:00+05:30", TimeValue.zoned(8, 0, null, 5, 30).toLabelString());
  }

  @Test
  void equalityIgnoresSecondScale() {
    assertEquals(
        TimeValue.local(1, 2, new BigDecimal("3.50")), TimeValue.local(1, 2, new BigDecimal("3.5")));
    assertEquals(
        TimeValue.local(1, 2, new BigDecimal("3.50")).hashCode(),
        TimeValue.local(1, 2, new BigDecimal("3.5")).hashCode());
    assertNotEquals(TimeValue.local(1, 2, null), TimeValue.utc(1, 2, null));
  }

  @Test
  void validatesFields() {
    assertThrows(LabelValidationException.class, () -> TimeValue.local(24, 0, null));
    assertThrows(LabelValidationException.class, () -> TimeValue.local(0, 60, null));
    assertThrows(LabelValidationException.class, () -> TimeValue.local(0, 0, new BigDecimal(60)));
    assertThrows(LabelValidationException.class, () -> TimeValue.zoned(0, 0, null, 13, null));
    assertThrows(LabelValidationException.class, () -> TimeValue.of(0, 0, null, false, null, 30));
  }

  @Test
  void dateTimeJoinsWithT() {
    DateTimeValue dt =
        new DateTimeValue(DateValue.ofDayOfYear(2001, 5), TimeValue.utc(0, 0, BigDecimal.ONE));
    assertEquals("2001-005T00:00:01Z", dt.toLabelString());
  }
}
