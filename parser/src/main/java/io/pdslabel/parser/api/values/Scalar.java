package io.pdslabel.parser.api.values;

/** A single, non-composite value. */
public sealed interface Scalar extends Value
    permits Numeric,
        DateValue,
        TimeValue,
        DateTimeValue,
        TextValue,
        SymbolValue,
        IdentifierValue {

  /**
   * Renders the value in the label grammar, e.g. {@code 16#4B#}, {@code 2015-032} or
   * {@code 'N/A'}.
   *
   * @return the canonical label text
   */
  String toLabelString();

  @Override
  default Scalar copy() {
    return this;
  }
}
