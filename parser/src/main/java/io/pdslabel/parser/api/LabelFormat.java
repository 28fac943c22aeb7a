package io.pdslabel.parser.api;

import java.util.Locale;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Layout settings for {@link LabelSerializer}.
 *
 * <p>The defaults may be overridden with system properties, read once when this class is loaded:
 *
 * <ul>
 *   <li>{@code io.pdslabel.format.line_separator}: {@code crlf} (default) or {@code lf}
 *   <li>{@code io.pdslabel.format.indent}: spaces per nesting level, default 1
 *   <li>{@code io.pdslabel.format.min_key_width}: minimum width of the key column, default 0
 * </ul>
 *
 * <p>An unusable property value is logged at WARN and the built-in default is used instead.
 */
public final class LabelFormat {
  public static final String CRLF = "\r\n";
  public static final String LF = "\n";

  static final String LINE_SEPARATOR_PROPERTY = "io.pdslabel.format.line_separator";
  static final String INDENT_PROPERTY = "io.pdslabel.format.indent";
  static final String MIN_KEY_WIDTH_PROPERTY = "io.pdslabel.format.min_key_width";

  private static final Logger log = LoggerFactory.getLogger(LabelFormat.class);

  private static final LabelFormat DEFAULT = fromProperties(System.getProperties());

  private final String lineSeparator;
  private final int indent;
  private final int minKeyWidth;

  private LabelFormat(String lineSeparator, int indent, int minKeyWidth) {
    this.lineSeparator = lineSeparator;
    this.indent = indent;
    this.minKeyWidth = minKeyWidth;
  }

  /**
   * Gets the default format, including any system property overrides.
   *
   * @return the default format
   */
  public static LabelFormat defaults() {
    return DEFAULT;
  }

  /**
   * Starts a builder initialised with the defaults.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder(DEFAULT);
  }

  public String lineSeparator() {
    return lineSeparator;
  }

  public int indent() {
    return indent;
  }

  public int minKeyWidth() {
    return minKeyWidth;
  }

  /**
   * Starts a builder initialised with this format.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    return new Builder(this);
  }

  /** Builds a format from the {@code io.pdslabel.format.*} entries of {@code properties}. */
  static LabelFormat fromProperties(Properties properties) {
    return new LabelFormat(
        lineSeparatorProperty(properties.getProperty(LINE_SEPARATOR_PROPERTY)),
        intProperty(properties, INDENT_PROPERTY, 1),
        intProperty(properties, MIN_KEY_WIDTH_PROPERTY, 0));
  }

  private static String lineSeparatorProperty(String value) {
    if (value == null) {
      return CRLF;
    }
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "crlf":
        return CRLF;
      case "lf":
        return LF;
      default:
        log.warn("Ignoring {}={}: expected 'crlf' or 'lf'", LINE_SEPARATOR_PROPERTY, value);
        return CRLF;
    }
  }

  private static int intProperty(Properties properties, String key, int fallback) {
    String value = properties.getProperty(key);
    if (value == null) {
      return fallback;
    }
    try {
      int parsed = Integer.parseInt(value.trim());
      if (parsed >= 0) {
        return parsed;
      }
    } catch (NumberFormatException e) {
      log.debug("{} is not an integer", key, e);
    }
    log.warn("Ignoring {}={}: expected a non-negative integer, using {}", key, value, fallback);
    return fallback;
  }

  private static int nonNegative(String what, int value) {
    if (value < 0) {
      throw new IllegalArgumentException(what + " must not be negative: " + value);
    }
    return value;
  }

  @Override
  public String toString() {
    return "LabelFormat{lineSeparator="
        + (CRLF.equals(lineSeparator) ? "CRLF" : "LF")
        + ", indent="
        + indent
        + ", minKeyWidth="
        + minKeyWidth
        + '}';
  }

  /** Builder for {@link LabelFormat}. */
  public static final class Builder {
    private String lineSeparator;
    private int indent;
    private int minKeyWidth;

    private Builder(LabelFormat from) {
      this.lineSeparator = from.lineSeparator;
      this.indent = from.indent;
      this.minKeyWidth = from.minKeyWidth;
    }

    /**
     * Sets the line separator.
     *
     * @param lineSeparator {@link #CRLF} or {@link #LF}
     * @return this builder
     */
    public Builder lineSeparator(String lineSeparator) {
      if (!CRLF.equals(lineSeparator) && !LF.equals(lineSeparator)) {
        throw new IllegalArgumentException("line separator must be CRLF or LF");
      }
      this.lineSeparator = lineSeparator;
      return this;
    }

    public Builder indent(int indent) {
      this.indent = nonNegative("indent", indent);
      return this;
    }

    public Builder minKeyWidth(int minKeyWidth) {
      this.minKeyWidth = nonNegative("minKeyWidth", minKeyWidth);
      return this;
    }

    public LabelFormat build() {
      return new LabelFormat(lineSeparator, indent, minKeyWidth);
    }
  }
}
