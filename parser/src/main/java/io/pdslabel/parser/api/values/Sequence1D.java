package io.pdslabel.parser.api.values;

import io.pdslabel.parser.api.LabelValidationException;
import io.pdslabel.utils.Indices;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered sequence of scalars, written {@code (1, 2.5, 'A')}.
 *
 * <p>A sequence may be emptied through mutation, but an empty sequence cannot be rendered: the
 * serializer rejects it. Indices may be negative, counting from the end.
 */
public final class Sequence1D implements Value, Iterable<Scalar> {
  private final List<Scalar> values = new ArrayList<>();

  public Sequence1D(Scalar... values) {
    for (Scalar v : values) {
      add(v);
    }
  }

  public Sequence1D(Iterable<? extends Scalar> values) {
    for (Scalar v : values) {
      add(v);
    }
  }

  public void add(Scalar value) {
    values.add(check(value));
  }

  /**
   * Inserts a value.
   *
   * @param index the insertion point, {@code -size()} to {@code size()}
   * @param value the value
   */
  public void insert(int index, Scalar value) {
    values.add(Indices.insertion(index, values.size()), check(value));
  }

  public Scalar get(int index) {
    return values.get(Indices.element(index, values.size()));
  }

  /**
   * Replaces a value.
   *
   * @param index the element index
   * @param value the new value
   * @return the previous value
   */
  public Scalar set(int index, Scalar value) {
    return values.set(Indices.element(index, values.size()), check(value));
  }

  public Scalar remove(int index) {
    return values.remove(Indices.element(index, values.size()));
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /**
   * Gets a read-only view of the values.
   *
   * @return the values in order
   */
  public List<Scalar> values() {
    return Collections.unmodifiableList(values);
  }

  private static Scalar check(Scalar value) {
    if (value == null) {
      throw new LabelValidationException("sequence values must not be null");
    }
    return value;
  }

  @Override
  public Iterator<Scalar> iterator() {
    return values().iterator();
  }

  @Override
  public Sequence1D copy() {
    return new Sequence1D(values);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Sequence1D)) return false;
    return values.equals(((Sequence1D) o).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.stream().map(Scalar::toLabelString).collect(Collectors.joining(", ", "(", ")"));
  }
}
