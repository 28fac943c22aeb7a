package io.pdslabel.parser.api.values;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pdslabel.parser.api.LabelValidationException;
import java.math.BigInteger;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;
import org.junit.jupiter.api.Test;

class BasedIntegerValueTest {

  @Test
  void derivesValueFromDigits() {
    assertThat(new BasedIntegerValue(16, "4B").value()).isEqualTo(BigInteger.valueOf(75));
    assertThat(new BasedIntegerValue(2, "1001011").value()).isEqualTo(BigInteger.valueOf(75));
    assertThat(new BasedIntegerValue(8, "113").value()).isEqualTo(BigInteger.valueOf(75));
    assertThat(new BasedIntegerValue(10, "75").longValue()).isEqualTo(75L);
    assertThat(new BasedIntegerValue(16, "-ff").longValue()).isEqualTo(-255L);
  }

  @Test
  void rendersDigitsAsWritten() {
    assertThat(new BasedIntegerValue(16, "4b").toLabelString()).isEqualTo("16#4b#");
    assertThat(new BasedIntegerValue(2, "+101", Units.of("bit")).toLabelString())
        .isEqualTo("2#+101# <BIT>");
  }

  @Test
  void rejectsDigitsOutsideRadix() {
    assertThatThrownBy(() -> new BasedIntegerValue(2, "102"))
        .isInstanceOf(LabelValidationException.class)
        .hasMessageContaining("digit '2' is not valid in radix 2");
    assertThatThrownBy(() -> new BasedIntegerValue(16, "G"))
        .isInstanceOf(LabelValidationException.class);
    assertThatThrownBy(() -> new BasedIntegerValue(16, "-"))
        .isInstanceOf(LabelValidationException.class);
  }

  @Test
  void rejectsRadixOutOfRange() {
    assertThatThrownBy(() -> new BasedIntegerValue(1, "0"))
        .isInstanceOf(LabelValidationException.class);
    assertThatThrownBy(() -> new BasedIntegerValue(17, "0"))
        .isInstanceOf(LabelValidationException.class);
  }

  @Property
  void matchesPositionalNotation(
      @ForAll @IntRange(min = 2, max = 16) int radix,
      @ForAll @LongRange(min = -1_000_000_000L, max = 1_000_000_000L) long n) {
    String digits = Long.toString(n, radix);
    assertThat(new BasedIntegerValue(radix, digits).longValue()).isEqualTo(n);
  }
}
