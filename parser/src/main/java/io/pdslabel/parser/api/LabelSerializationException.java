package io.pdslabel.parser.api;

/**
 * Thrown when a label cannot be rendered. The only such case is a sequence that was emptied after
 * construction: the grammar has no literal for an empty sequence.
 */
public class LabelSerializationException extends IllegalStateException {
  private final String context;

  public LabelSerializationException(String message, String context) {
    super(LabelParseException.formatMessage(message, -1, context, "SERIALIZATION"));
    this.context = context;
  }

  /**
   * Creates a LabelSerializationException for an empty sequence.
   *
   * @param identifier the attribute holding the sequence
   * @return a new LabelSerializationException instance
   */
  public static LabelSerializationException emptySequence(Identifier identifier) {
    return new LabelSerializationException(
        "Sequence does not contain at least 1 value", identifier.text());
  }

  public String getContext() {
    return context;
  }
}
