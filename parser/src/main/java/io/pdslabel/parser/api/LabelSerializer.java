package io.pdslabel.parser.api;

import io.pdslabel.parser.api.statements.Label;
import io.pdslabel.parser.impl.LabelWriter;

/**
 * Renders a {@link Label} tree as label text.
 *
 * <p>Sibling lines are aligned on the {@code =} column, nested blocks are indented, and the output
 * always ends with the {@code END} line. Rendering fails only for a sequence without elements,
 * which has no textual form.
 */
public interface LabelSerializer {
  /**
   * Creates a serializer using {@link LabelFormat#defaults()}.
   *
   * @return a new serializer
   */
  static LabelSerializer create() {
    return create(LabelFormat.defaults());
  }

  /**
   * Creates a serializer with a custom layout.
   *
   * @param format the layout
   * @return a new serializer
   */
  static LabelSerializer create(LabelFormat format) {
    return new LabelWriter(format);
  }

  /**
   * Renders a label.
   *
   * @param label the label
   * @return the US-ASCII encoded text
   * @throws LabelSerializationException if the label contains an empty sequence
   */
  byte[] render(Label label);

  /**
   * Renders a label as a string.
   *
   * @param label the label
   * @return the text
   * @throws LabelSerializationException if the label contains an empty sequence
   */
  String renderToString(Label label);
}
