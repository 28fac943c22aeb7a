package io.pdslabel.parser.api;

import io.pdslabel.utils.AsciiChars;
import java.util.Locale;
import java.util.Set;

/**
 * Name of a statement or an identifier value.
 *
 * <p>An identifier is a letter followed by letters and digits, optionally separated by single
 * underscores ({@code SPACECRAFT_NAME}, {@code LINE_SAMPLES}). Attribute names may additionally
 * carry either a namespace ({@code PDS:VERSION_ID}) or the pointer marker ({@code ^IMAGE}), not
 * both. Identifiers are case-insensitive: the text is folded to upper case on construction and all
 * comparisons are made on the folded form.
 */
public final class Identifier {
  private static final Set<String> RESERVED =
      Set.of("END", "GROUP", "BEGIN_GROUP", "END_GROUP", "OBJECT", "BEGIN_OBJECT", "END_OBJECT");

  private final boolean pointer;
  private final String namespace;
  private final String name;
  private final String text;

  private Identifier(boolean pointer, String namespace, String name) {
    this.pointer = pointer;
    this.namespace = namespace;
    this.name = name;
    StringBuilder sb = new StringBuilder();
    if (pointer) {
      sb.append('^');
    }
    if (namespace != null) {
      sb.append(namespace).append(':');
    }
    this.text = sb.append(name).toString();
  }

  /**
   * Parses an identifier, with an optional {@code ^} marker or {@code namespace:} prefix.
   *
   * @param text the identifier text, any case
   * @return the identifier
   * @throws LabelValidationException if {@code text} is not a valid identifier
   */
  public static Identifier of(String text) {
    if (text == null) {
      throw LabelValidationException.invalid("identifier", null);
    }
    String rest = text;
    boolean pointer = rest.startsWith("^");
    if (pointer) {
      rest = rest.substring(1);
    }
    String namespace = null;
    int colon = rest.indexOf(':');
    if (colon >= 0) {
      if (pointer) {
        throw new LabelValidationException("pointer identifier cannot have a namespace", text);
      }
      namespace = rest.substring(0, colon);
      rest = rest.substring(colon + 1);
      if (!isValidName(namespace)) {
        throw LabelValidationException.invalid("identifier", text);
      }
    }
    if (!isValidName(rest)) {
      throw LabelValidationException.invalid("identifier", text);
    }
    return new Identifier(pointer, fold(namespace), fold(rest));
  }

  /**
   * Creates an identifier without namespace or pointer marker, as used for group and object
   * names and for identifier values.
   *
   * @param name the name, any case
   * @return the identifier
   * @throws LabelValidationException if {@code name} is not a valid plain identifier
   */
  public static Identifier plain(String name) {
    if (!isValidName(name)) {
      throw LabelValidationException.invalid("identifier", name);
    }
    return new Identifier(false, null, fold(name));
  }

  /**
   * Checks the plain identifier grammar, {@code letter (['_'] (letter | digit))*}, and that the
   * name is not one of the reserved words.
   *
   * @param name the candidate name
   * @return {@code true} if {@code name} can be used as a plain identifier
   */
  public static boolean isValidName(String name) {
    if (name == null || name.isEmpty() || !AsciiChars.isLetter(name.charAt(0))) {
      return false;
    }
    char prev = name.charAt(0);
    for (int i = 1; i < name.length(); i++) {
      char c = name.charAt(i);
      if (c == '_') {
        if (prev == '_') {
          return false;
        }
      } else if (!AsciiChars.isLetterOrDigit(c)) {
        return false;
      }
      prev = c;
    }
    return prev != '_' && !isReserved(name);
  }

  /**
   * Checks whether a word is one of the statement keywords ({@code END}, {@code GROUP},
   * {@code END_OBJECT}, ...), in any case.
   */
  public static boolean isReserved(String word) {
    return RESERVED.contains(fold(word));
  }

  private static String fold(String s) {
    return s == null ? null : s.toUpperCase(Locale.ROOT);
  }

  /** Whether the identifier is a pointer ({@code ^NAME}). */
  public boolean isPointer() {
    return pointer;
  }

  /**
   * Gets the namespace.
   *
   * @return the upper-cased namespace, or {@code null} if there is none
   */
  public String namespace() {
    return namespace;
  }

  /**
   * Gets the name without pointer marker and namespace.
   *
   * @return the upper-cased name
   */
  public String name() {
    return name;
  }

  /** Whether the identifier has neither namespace nor pointer marker. */
  public boolean isPlain() {
    return !pointer && namespace == null;
  }

  /**
   * Gets the full canonical text, e.g. {@code ^IMAGE} or {@code PDS:VERSION_ID}.
   *
   * @return the upper-cased identifier text
   */
  public String text() {
    return text;
  }

  /**
   * Compares with a string the way container lookups do.
   *
   * @param other the text to compare with, any case
   * @return {@code true} if the texts are equal ignoring case
   */
  public boolean matches(String other) {
    return text.equalsIgnoreCase(other);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Identifier)) return false;
    return text.equals(((Identifier) o).text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @Override
  public String toString() {
    return text;
  }
}
