package com.starscape.mediareaper.common.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base class for persistent domain objects.
 * Identity is the id; two transient instances (null id) are never equal.
 */
public abstract class Entity<ID extends Serializable> {

    protected Entity() {
        // JPA constructor
    }

    public abstract ID getId();

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Entity<?> other = (Entity<?>) o;
        return getId() != null && Objects.equals(getId(), other.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
