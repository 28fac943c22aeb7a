/**
 * Public API for the PDS label parser.
 *
 * <p><b>Entry points</b>
 *
 * <ul>
 *   <li>{@link io.pdslabel.parser.api.LabelParser} turns label bytes into a {@link
 *       io.pdslabel.parser.api.statements.Label} tree and reports malformed input as a {@link
 *       io.pdslabel.parser.api.LabelParseException}.
 *   <li>{@link io.pdslabel.parser.api.LabelSerializer} renders a tree back to text, laid out by a
 *       {@link io.pdslabel.parser.api.LabelFormat}.
 * </ul>
 *
 * <p><b>Errors</b>
 *
 * <ul>
 *   <li>{@link io.pdslabel.parser.api.LabelParseException} (checked): the input is not a label.
 *   <li>{@link io.pdslabel.parser.api.LabelValidationException}: a value, identifier or statement
 *       was constructed or inserted with invalid contents.
 *   <li>{@link io.pdslabel.parser.api.LabelSerializationException}: a sequence was emptied after
 *       construction and can no longer be rendered.
 * </ul>
 *
 * <p><b>Example</b>
 *
 * <pre>{@code
 * Label label = LabelParser.parse(Path.of("image.img"));
 * label.set("PRODUCT_ID", IdentifierValue.of("X1234"));
 * byte[] text = LabelSerializer.create().render(label);
 * }</pre>
 */
package io.pdslabel.parser.api;
