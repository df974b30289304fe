package com.starscape.todoapp.common.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base type for identified domain objects. Identity is assigned by the store,
 * so two transient instances (null id) are never equal.
 */
public abstract class Entity<ID extends Serializable> {

    public abstract ID getId();

    public boolean isNew() {
        return getId() == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity<?> other = (Entity<?>) o;
        return getId() != null && Objects.equals(getId(), other.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
