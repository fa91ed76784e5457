package org.brainobservatory.dataobject;

import lombok.Getter;

import java.util.Objects;

/**
 * Named immutable value extracted from, or written to, an external session representation.
 *
 * @param <T> value type.
 */
@Getter
public abstract class DataObject<T> {
    private final String name;
    private final T value;

    protected DataObject(String name, T value) {
        this.name = Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must be non-blank");
        }
        this.value = Objects.requireNonNull(value, "value");
    }
}
