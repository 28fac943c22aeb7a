package io.pdslabel.parser.api.values;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pdslabel.parser.api.LabelValidationException;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class ScalarValuesTest {

  @Test
  void integerKeepsArbitraryPrecision() {
    IntegerValue big = IntegerValue.parse("123456789012345678901234567890", null);
    assertThat(big.value()).isEqualTo(new BigInteger("123456789012345678901234567890"));
    assertThatThrownBy(big::longValue).isInstanceOf(ArithmeticException.class);
    assertThat(IntegerValue.parse("+7", null).toLabelString()).isEqualTo("7");
    assertThatThrownBy(() -> IntegerValue.parse("7.0", null))
        .isInstanceOf(LabelValidationException.class);
  }

  @Test
  void realRendersWithFractionalDigit() {
    assertThat(RealValue.of(3).toLabelString()).isEqualTo("3.0");
    assertThat(RealValue.parse("1.", null).value()).isEqualTo(1.0);
    assertThat(RealValue.parse(".5", null).value()).isEqualTo(0.5);
    assertThat(RealValue.parse("-2.5E-3", null).value()).isEqualTo(-0.0025);
    assertThat(RealValue.parse("7.9", null).longValue()).isEqualTo(7L);
    assertThatThrownBy(() -> RealValue.of(Double.NaN))
        .isInstanceOf(LabelValidationException.class);
    assertThatThrownBy(() -> RealValue.parse("1e", null))
        .isInstanceOf(LabelValidationException.class);
  }

  @Test
  void textIsKeptVerbatim() {
    TextValue text = TextValue.of("line one\r\n  line two");
    assertThat(text.toLabelString()).isEqualTo("\"line one\r\n  line two\"");
    assertThatThrownBy(() -> TextValue.of("say \"hi\""))
        .isInstanceOf(LabelValidationException.class);
    assertThatThrownBy(() -> TextValue.of("café"))
        .isInstanceOf(LabelValidationException.class)
        .hasMessageContaining("\\u00e9");
  }

  @Test
  void symbolIsUppercased() {
    assertThat(SymbolValue.of("n/a").toLabelString()).isEqualTo("'N/A'");
    assertThatThrownBy(() -> SymbolValue.of("")).isInstanceOf(LabelValidationException.class);
    assertThatThrownBy(() -> SymbolValue.of("it's"))
        .isInstanceOf(LabelValidationException.class);
    assertThatThrownBy(() -> SymbolValue.of("a\tb")).isInstanceOf(LabelValidationException.class);
  }

  @Test
  void identifierValueMustBePlain() {
    assertThat(IdentifierValue.of("mars").toLabelString()).isEqualTo("MARS");
    assertThatThrownBy(() -> IdentifierValue.of("^MARS"))
        .isInstanceOf(LabelValidationException.class);
  }
}
