package com.ethnicthv.dyneq.core.erasure;

import java.util.Objects;

/**
 * Stable runtime identity of a concrete type. Two ids are equal iff they denote the same
 * {@link Class}.
 */
public final class TypeId {
    private final Class<?> type;

    private TypeId(Class<?> type) {
        this.type = type;
    }

    public static TypeId of(Class<?> type) {
        return new TypeId(Objects.requireNonNull(type, "type"));
    }

    public static TypeId of(Object value) {
        return new TypeId(Objects.requireNonNull(value, "value").getClass());
    }

    /**
     * Whether this id denotes exactly {@code target}; subclasses do not match.
     */
    public boolean is(Class<?> target) {
        return type == target;
    }

    public Class<?> type() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeId that)) return false;
        return type == that.type;
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        return "TypeId[" + type.getName() + "]";
    }
}
