package com.ethnicthv.dyneq.core;

import com.ethnicthv.dyneq.core.erasure.ErasedRef;
import com.ethnicthv.dyneq.core.erasure.TypeId;

/**
 * Capability that lets interface-typed values be compared for equality without knowing
 * their concrete types.
 * <p>
 * Make an interface comparable by extending this one and annotating it with
 * {@link com.ethnicthv.dyneq.core.annotation.DynEqObject}:
 * <pre>{@code
 * @DynEqObject
 * public interface Shape extends DynEq {
 *     double area();
 * }
 *
 * public record Circle(double radius) implements Shape { ... }
 * public record Square(double side) implements Shape { ... }
 *
 * Shape a = new Circle(1), b = new Circle(1), c = new Square(1);
 * ShapeEquality.eq(a, b); // true
 * ShapeEquality.eq(a, c); // false, different concrete types
 * }</pre>
 * Both methods are supplied by default and must never be overridden. The annotation processor
 * rejects overrides, and rejects concrete implementers that do not declare {@code equals}
 * (records and enums qualify implicitly).
 */
public interface DynEq {

    /**
     * Runtime identity of this value's concrete type.
     */
    default TypeId dynTypeId() {
        return TypeId.of(getClass());
    }

    /**
     * Compares this value with a type-erased peer.
     * <p>
     * The peer is downcast to this value's exact runtime class first; a peer of any other
     * class yields {@code false}. Otherwise the result is this type's own {@code equals}.
     *
     * @param other erased peer, never null
     * @return whether both are the same concrete type and equal under its {@code equals}
     */
    default boolean dynEq(ErasedRef other) {
        Object peer = other.downcastOrNull(getClass());
        return peer != null && this.equals(peer);
    }
}
