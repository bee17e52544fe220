package com.newsflow.core.state;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Merge rule and default value of one state field.
 *
 * @param discipline   how concurrent writes to the field combine
 * @param defaultValue supplies the initial value when the caller leaves the field out (nullable)
 */
public record Channel(Discipline discipline, Supplier<?> defaultValue) {

    public enum Discipline {
        /** Last writer in launch order wins. */
        OVERWRITE,
        /** Contributions are concatenated; the field never shrinks. */
        APPEND
    }

    public Channel {
        Objects.requireNonNull(discipline, "discipline must not be null");
    }

    public boolean appends() {
        return discipline == Discipline.APPEND;
    }

    Object initialValue() {
        return defaultValue != null ? defaultValue.get() : null;
    }
}
