package io.pdslabel.parser.impl;

import io.pdslabel.parser.api.Identifier;
import io.pdslabel.parser.api.LabelFormat;
import io.pdslabel.parser.api.LabelSerializationException;
import io.pdslabel.parser.api.LabelSerializer;
import io.pdslabel.parser.api.statements.AttributeStatement;
import io.pdslabel.parser.api.statements.GroupStatement;
import io.pdslabel.parser.api.statements.Label;
import io.pdslabel.parser.api.statements.ObjectStatement;
import io.pdslabel.parser.api.statements.Statement;
import io.pdslabel.parser.api.statements.StatementKind;
import io.pdslabel.parser.api.statements.Statements;
import io.pdslabel.parser.api.values.Scalar;
import io.pdslabel.parser.api.values.Sequence1D;
import io.pdslabel.parser.api.values.Sequence2D;
import io.pdslabel.parser.api.values.SetValue;
import io.pdslabel.parser.api.values.Value;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-by-line label renderer.
 *
 * <p>Within one container every line pads its key to the container's key width, the longest key
 * among the attribute identifiers and the open and close keywords of its blocks. Nested containers
 * compute their own width.
 */
public final class LabelWriter implements LabelSerializer {
  private static final Logger log = LoggerFactory.getLogger(LabelWriter.class);

  private final LabelFormat format;

  public LabelWriter(LabelFormat format) {
    this.format = format;
  }

  @Override
  public byte[] render(Label label) {
    return renderToString(label).getBytes(StandardCharsets.US_ASCII);
  }

  @Override
  public String renderToString(Label label) {
    StringBuilder out = new StringBuilder();
    writeStatements(out, label, 0);
    out.append("END").append(format.lineSeparator());
    log.debug("Rendered {} top-level statements into {} bytes", label.size(), out.length());
    return out.toString();
  }

  private void writeStatements(StringBuilder out, Statements statements, int level) {
    int width = keyWidth(statements);
    for (Statement statement : statements) {
      if (statement instanceof AttributeStatement) {
        AttributeStatement attribute = (AttributeStatement) statement;
        line(out, level, width, attribute.identifier().text(), value(attribute));
      } else if (statement instanceof GroupStatement) {
        GroupStatement group = (GroupStatement) statement;
        block(out, level, width, StatementKind.GROUP, group.identifier(), group.statements());
      } else {
        ObjectStatement object = (ObjectStatement) statement;
        block(out, level, width, StatementKind.OBJECT, object.identifier(), object.statements());
      }
    }
  }

  private void block(
      StringBuilder out,
      int level,
      int width,
      StatementKind kind,
      Identifier name,
      Statements body) {
    line(out, level, width, kind.openKeyword(), name.text());
    writeStatements(out, body, level + 1);
    line(out, level, width, kind.closeKeyword(), name.text());
  }

  private int keyWidth(Statements statements) {
    int width = format.minKeyWidth();
    for (Statement statement : statements) {
      StatementKind kind = statement.kind();
      int key =
          kind == StatementKind.ATTRIBUTE
              ? statement.identifier().text().length()
              : Math.max(kind.openKeyword().length(), kind.closeKeyword().length());
      width = Math.max(width, key);
    }
    return width;
  }

  private void line(StringBuilder out, int level, int width, String key, String value) {
    out.append(" ".repeat(level * format.indent())).append(key);
    out.append(" ".repeat(width - key.length()));
    out.append(" = ").append(value).append(format.lineSeparator());
  }

  private static String value(AttributeStatement attribute) {
    Value value = attribute.value();
    if (value instanceof Scalar) {
      return ((Scalar) value).toLabelString();
    }
    StringBuilder sb = new StringBuilder();
    if (value instanceof SetValue) {
      sb.append('{');
      String sep = "";
      for (Scalar member : (SetValue) value) {
        sb.append(sep).append(member.toLabelString());
        sep = ", ";
      }
      return sb.append('}').toString();
    }
    if (value instanceof Sequence1D) {
      sequence(sb, (Sequence1D) value, attribute.identifier());
      return sb.toString();
    }
    Sequence2D rows = (Sequence2D) value;
    if (rows.isEmpty()) {
      throw LabelSerializationException.emptySequence(attribute.identifier());
    }
    sb.append('(');
    String sep = "";
    for (Sequence1D row : rows) {
      sb.append(sep);
      sequence(sb, row, attribute.identifier());
      sep = ", ";
    }
    return sb.append(')').toString();
  }

  private static void sequence(StringBuilder sb, Sequence1D seq, Identifier owner) {
    if (seq.isEmpty()) {
      throw LabelSerializationException.emptySequence(owner);
    }
    sb.append('(');
    String sep = "";
    for (Scalar element : seq) {
      sb.append(sep).append(element.toLabelString());
      sep = ", ";
    }
    sb.append(')');
  }
}
