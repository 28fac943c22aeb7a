package io.pdslabel.parser.api.values;

import io.pdslabel.parser.api.LabelValidationException;
import io.pdslabel.utils.Indices;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered sequence of {@link Sequence1D} rows, written {@code ((1, 2), (3, 4))}. Nesting stops at
 * two levels.
 */
public final class Sequence2D implements Value, Iterable<Sequence1D> {
  private final List<Sequence1D> rows = new ArrayList<>();

  public Sequence2D(Sequence1D... rows) {
    for (Sequence1D r : rows) {
      add(r);
    }
  }

  public Sequence2D(Iterable<Sequence1D> rows) {
    for (Sequence1D r : rows) {
      add(r);
    }
  }

  public void add(Sequence1D row) {
    rows.add(check(row));
  }

  public void insert(int index, Sequence1D row) {
    rows.add(Indices.insertion(index, rows.size()), check(row));
  }

  public Sequence1D get(int index) {
    return rows.get(Indices.element(index, rows.size()));
  }

  public Sequence1D set(int index, Sequence1D row) {
    return rows.set(Indices.element(index, rows.size()), check(row));
  }

  public Sequence1D remove(int index) {
    return rows.remove(Indices.element(index, rows.size()));
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public List<Sequence1D> rows() {
    return Collections.unmodifiableList(rows);
  }

  private static Sequence1D check(Sequence1D row) {
    if (row == null) {
      throw new LabelValidationException("sequence rows must not be null");
    }
    return row;
  }

  @Override
  public Iterator<Sequence1D> iterator() {
    return rows().iterator();
  }

  @Override
  public Sequence2D copy() {
    Sequence2D copy = new Sequence2D();
    for (Sequence1D row : rows) {
      copy.add(row.copy());
    }
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Sequence2D)) return false;
    return rows.equals(((Sequence2D) o).rows);
  }

  @Override
  public int hashCode() {
    return rows.hashCode();
  }

  @Override
  public String toString() {
    return rows.stream().map(Sequence1D::toString).collect(Collectors.joining(", ", "(", ")"));
  }
}
