package com.ethnicthv.dyneq.core;

import java.util.Objects;

/**
 * Owning wrapper around an interface-typed value whose {@code equals}/{@code hashCode} follow
 * {@link DynEqSupport}. Generated per interface and marker combination; a box is only ever
 * equal to a box of the same generated class.
 * <p>
 * Boxes make interface-typed fields usable inside records:
 * <pre>{@code
 * record Scene(String name, ShapeEquality.Box shape) {}
 * }</pre>
 *
 * @param <T> boxed interface type
 */
public abstract class DynBox<T extends DynEq> {
    private final T value;

    protected DynBox(T value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public final T get() {
        return value;
    }

    /**
     * Compares the boxed value with a bare reference of the boxed type.
     */
    public final boolean equalsValue(T other) {
        return DynEqSupport.dynEquals(value, other);
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        return DynEqSupport.dynEquals(value, ((DynBox<?>) o).value);
    }

    @Override
    public final int hashCode() {
        return DynEqSupport.dynHash(value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + value + "]";
    }
}
