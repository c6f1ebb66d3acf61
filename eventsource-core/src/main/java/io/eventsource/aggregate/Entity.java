package io.eventsource.aggregate;

import io.eventsource.Identifier;

import java.util.Objects;

/**
 * Object with a stable identity. Two entities are equal iff they are of the same class
 * and their identifiers are equal; state never takes part in equality.
 *
 * @param <ID> the identifier type
 */
public abstract class Entity<ID extends Identifier> {
  private final ID id;

  protected Entity(ID id) {
    this.id = Objects.requireNonNull(id, "id");
  }

  public final ID id() {
    return id;
  }

  @Override
  public final boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return id.equals(((Entity<?>) o).id);
  }

  @Override
  public final int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{id=" + id.value() + "}";
  }
}
