package io.pdslabel.parser.api.statements;

import io.pdslabel.parser.api.Identifier;
import io.pdslabel.parser.api.LabelValidationException;
import io.pdslabel.parser.api.values.Value;
import io.pdslabel.utils.Indices;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Ordered sequence of statements, addressable both by index and by identifier.
 *
 * <p>{@link Label}, {@link GroupStatements} and {@link ObjectStatements} are this one container
 * configured with the statement kinds they accept; a statement of any other kind is rejected on
 * insertion with a {@link LabelValidationException}.
 *
 * <p>Index arguments may be negative, counting from the end. Identifier arguments are
 * case-insensitive. Duplicate identifiers may be stored; identifier-based operations act on the
 * first match, scanning from index 0.
 *
 * <p>The container exclusively owns its statements, so a label is always a finite tree. The
 * statements passed to a constructor are deep-copied. A block statement added later is adopted
 * together with its body; a body that already belongs to a container, or one that would end up
 * inside itself, is rejected. Attribute values that are collections are copied on insertion, so
 * edits go through {@link #getValue(String)}.
 *
 * <p>The container is not thread-safe, and it must not be modified while one of its iterators is
 * in use: the iterators are fail-fast.
 */
public abstract sealed class Statements implements Iterable<Statement>
    permits Label, GroupStatements, ObjectStatements {
  private final Set<StatementKind> accepted;
  private final List<Statement> statements = new ArrayList<>();
  // container holding the block statement whose body this is
  private Statements owner;

  protected Statements(Set<StatementKind> accepted, Iterable<? extends Statement> initial) {
    this.accepted = Collections.unmodifiableSet(EnumSet.copyOf(accepted));
    for (Statement s : initial) {
      if (s == null) {
        throw new LabelValidationException("statement must not be null");
      }
      append(s.copy());
    }
  }

  /**
   * Gets the statement kinds this container accepts.
   *
   * @return the accepted kinds
   */
  public Set<StatementKind> acceptedKinds() {
    return accepted;
  }

  public int size() {
    return statements.size();
  }

  public boolean isEmpty() {
    return statements.isEmpty();
  }

  /**
   * Gets the statement at an index.
   *
   * @param index {@code -size()} to {@code size() - 1}
   * @return the statement
   * @throws IndexOutOfBoundsException if the index is out of range
   */
  public Statement get(int index) {
    return statements.get(Indices.element(index, size()));
  }

  /**
   * Inserts a statement before the one currently at {@code index}.
   *
   * @param index {@code -size()} to {@code size()}; {@code size()} appends
   * @param statement the statement
   * @throws IndexOutOfBoundsException if the index is out of range
   * @throws LabelValidationException if this container does not accept the statement's kind, or
   *     the statement's body is already owned or encloses this container
   */
  public void insert(int index, Statement statement) {
    int at = Indices.insertion(index, size());
    statements.add(at, adopt(statement, null));
  }

  /**
   * Appends a statement.
   *
   * @param statement the statement
   * @throws LabelValidationException if this container does not accept the statement's kind, or
   *     the statement's body is already owned or encloses this container
   */
  public void append(Statement statement) {
    statements.add(adopt(statement, null));
  }

  /**
   * Replaces the statement at an index.
   *
   * @param index {@code -size()} to {@code size() - 1}
   * @param statement the replacement
   * @return the replaced statement
   * @throws IndexOutOfBoundsException if the index is out of range
   * @throws LabelValidationException if the statement cannot be adopted, as for {@link #append}
   */
  public Statement set(int index, Statement statement) {
    int at = Indices.element(index, size());
    Statement replaced = statements.get(at);
    statements.set(at, adopt(statement, replaced));
    release(replaced, statement);
    return replaced;
  }

  /**
   * Removes and returns the statement at an index.
   *
   * @param index {@code -size()} to {@code size() - 1}
   * @return the removed statement
   * @throws IndexOutOfBoundsException if the index is out of range
   */
  public Statement pop(int index) {
    Statement removed = statements.remove(Indices.element(index, size()));
    release(removed, null);
    return removed;
  }

  /**
   * Removes and returns the last statement.
   *
   * @return the removed statement
   * @throws IndexOutOfBoundsException if the container is empty
   */
  public Statement pop() {
    return pop(-1);
  }

  /**
   * Finds the index of the first statement with the given identifier.
   *
   * @param identifier the identifier, any case
   * @return the index, or {@code -1}
   */
  public int indexOf(String identifier) {
    for (int i = 0; i < statements.size(); i++) {
      if (statements.get(i).identifier().matches(identifier)) {
        return i;
      }
    }
    return -1;
  }

  public boolean contains(String identifier) {
    return indexOf(identifier) >= 0;
  }

  public Optional<Statement> find(String identifier) {
    int at = indexOf(identifier);
    return at < 0 ? Optional.empty() : Optional.of(statements.get(at));
  }

  /**
   * Gets the first statement with the given identifier.
   *
   * @param identifier the identifier, any case
   * @return the statement
   * @throws NoSuchElementException if there is no such statement
   */
  public Statement get(String identifier) {
    return find(identifier).orElseThrow(() -> missing(identifier));
  }

  /**
   * Gets the value of the first attribute with the given identifier.
   *
   * @param identifier the identifier, any case
   * @return the attribute value
   * @throws NoSuchElementException if there is no such statement, or it is a block
   */
  public Value getValue(String identifier) {
    Statement s = get(identifier);
    if (!(s instanceof AttributeStatement)) {
      throw new NoSuchElementException(
          String.format("'%s' is a %s, not an attribute", s.identifier(), s.kind()));
    }
    return ((AttributeStatement) s).value();
  }

  /**
   * Assigns a value by identifier. An existing statement with that identifier is replaced by an
   * attribute in the same position; otherwise a new attribute is appended.
   *
   * @param identifier the identifier, any case
   * @param value the value
   * @throws LabelValidationException if a new attribute would need an invalid identifier
   */
  public void set(String identifier, Value value) {
    int at = indexOf(identifier);
    if (at < 0) {
      append(new AttributeStatement(Identifier.of(identifier), value));
    } else {
      set(at, new AttributeStatement(statements.get(at).identifier(), value));
    }
  }

  /**
   * Assigns a group by identifier, replacing the first statement with that identifier in place or
   * appending a new group.
   *
   * @param identifier the group name, any case
   * @param group the group's statements
   * @throws LabelValidationException if this container does not accept groups
   */
  public void set(String identifier, GroupStatements group) {
    replaceOrAppend(identifier, new GroupStatement(Identifier.plain(identifier), group));
  }

  /**
   * Assigns an object by identifier, replacing the first statement with that identifier in place
   * or appending a new object.
   *
   * @param identifier the object name, any case
   * @param object the object's statements
   * @throws LabelValidationException if this container does not accept objects
   */
  public void set(String identifier, ObjectStatements object) {
    replaceOrAppend(identifier, new ObjectStatement(Identifier.plain(identifier), object));
  }

  private void replaceOrAppend(String identifier, Statement statement) {
    int at = indexOf(identifier);
    if (at < 0) {
      append(statement);
    } else {
      set(at, statement);
    }
  }

  /**
   * Removes the first statement with the given identifier.
   *
   * @param identifier the identifier, any case
   * @return the removed statement
   * @throws NoSuchElementException if there is no such statement
   */
  public Statement remove(String identifier) {
    int at = indexOf(identifier);
    if (at < 0) {
      throw missing(identifier);
    }
    return pop(at);
  }

  /** Iterates from the first statement to the last. */
  @Override
  public Iterator<Statement> iterator() {
    return Collections.unmodifiableList(statements).iterator();
  }

  /**
   * Iterates from the last statement to the first. Each call to {@code iterator()} on the result
   * starts over from the container's current state.
   *
   * @return the statements in reverse order
   */
  public Iterable<Statement> reversed() {
    return () ->
        new Iterator<>() {
          private final ListIterator<Statement> it = statements.listIterator(statements.size());

          @Override
          public boolean hasNext() {
            return it.hasPrevious();
          }

          @Override
          public Statement next() {
            return it.previous();
          }
        };
  }

  public Stream<Statement> stream() {
    return statements.stream();
  }

  /**
   * Returns an independent deep copy of this container.
   *
   * @return the copy
   */
  public abstract Statements copy();

  /** Appends deep copies of all statements of this container to {@code target}. */
  protected <T extends Statements> T copyInto(T target) {
    for (Statement s : statements) {
      target.append(s.copy());
    }
    return target;
  }

  private Statement adopt(Statement statement, Statement replaced) {
    if (statement == null) {
      throw new LabelValidationException("statement must not be null");
    }
    if (!accepted.contains(statement.kind())) {
      throw new LabelValidationException(
          String.format(
              "%s does not accept %s statements", getClass().getSimpleName(), statement.kind()),
          statement.identifier().text());
    }
    Statements body = bodyOf(statement);
    if (body == null) {
      AttributeStatement attribute = (AttributeStatement) statement;
      Value value = attribute.value().copy();
      return value == attribute.value()
          ? attribute
          : new AttributeStatement(attribute.identifier(), value);
    }
    for (Statements c = this; c != null; c = c.owner) {
      if (c == body) {
        throw new LabelValidationException(
            String.format(
                "%s '%s' cannot be nested inside itself",
                statement.kind(), statement.identifier().text()),
            statement.identifier().text());
      }
    }
    if (body.owner != null && (replaced == null || bodyOf(replaced) != body)) {
      throw new LabelValidationException(
          String.format(
              "Statements of %s '%s' already belong to another container; add a copy instead",
              statement.kind(), statement.identifier().text()),
          statement.identifier().text());
    }
    body.owner = this;
    return statement;
  }

  private static void release(Statement removed, Statement replacement) {
    Statements body = bodyOf(removed);
    if (body != null && (replacement == null || bodyOf(replacement) != body)) {
      body.owner = null;
    }
  }

  private static Statements bodyOf(Statement statement) {
    if (statement instanceof GroupStatement) {
      return ((GroupStatement) statement).statements();
    }
    if (statement instanceof ObjectStatement) {
      return ((ObjectStatement) statement).statements();
    }
    return null;
  }

  private static NoSuchElementException missing(String identifier) {
    return new NoSuchElementException("No statement with identifier '" + identifier + "'");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return statements.equals(((Statements) o).statements);
  }

  @Override
  public int hashCode() {
    return statements.hashCode();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + statements;
  }
}
