package io.pdslabel.parser.api.values;

import io.pdslabel.parser.api.LabelValidationException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Unordered collection of unique {@link IntegerValue} and {@link SymbolValue} members, written
 * {@code {1, 'A', 3}}.
 *
 * <p>Members compare by value. Iteration, and therefore rendering, follows insertion order.
 */
public final class SetValue implements Value, Iterable<Scalar> {
  private final Set<Scalar> members = new LinkedHashSet<>();

  /**
   * Creates a set.
   *
   * @param values the initial members; duplicates are dropped
   * @throws LabelValidationException if a member is neither an integer nor a symbol
   */
  public SetValue(Scalar... values) {
    for (Scalar v : values) {
      add(v);
    }
  }

  public SetValue(Iterable<? extends Scalar> values) {
    for (Scalar v : values) {
      add(v);
    }
  }

  /**
   * Adds a member.
   *
   * @param value an {@link IntegerValue} or {@link SymbolValue}
   * @return {@code true} if the set did not already contain the value
   * @throws LabelValidationException if the value is of another kind
   */
  public boolean add(Scalar value) {
    if (!(value instanceof IntegerValue) && !(value instanceof SymbolValue)) {
      throw new LabelValidationException(
          "set members must be integers or symbols",
          value == null ? "null" : value.getClass().getSimpleName());
    }
    return members.add(value);
  }

  public boolean remove(Scalar value) {
    return members.remove(value);
  }

  public boolean contains(Scalar value) {
    return members.contains(value);
  }

  public int size() {
    return members.size();
  }

  public boolean isEmpty() {
    return members.isEmpty();
  }

  public void clear() {
    members.clear();
  }

  /**
   * Gets a read-only view of the members.
   *
   * @return the members in insertion order
   */
  public Set<Scalar> members() {
    return Collections.unmodifiableSet(members);
  }

  @Override
  public Iterator<Scalar> iterator() {
    return members().iterator();
  }

  @Override
  public SetValue copy() {
    return new SetValue(members);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SetValue)) return false;
    return members.equals(((SetValue) o).members);
  }

  @Override
  public int hashCode() {
    return members.hashCode();
  }

  @Override
  public String toString() {
    return members.stream().map(Scalar::toLabelString).collect(Collectors.joining(", ", "{", "}"));
  }
}
