package com.ethnicthv.dyneq.core;

import com.ethnicthv.dyneq.core.erasure.ErasedRef;

/**
 * Comparison routines shared by the generated {@code <Interface>Equality} classes and
 * {@link DynBox}.
 */
public final class DynEqSupport {

    private static final TotalEquality<DynEq> TOTAL = new TotalEquality<>() {
        @Override
        public boolean equivalent(DynEq a, DynEq b) {
            return dynEquals(a, b);
        }

        @Override
        public int hash(DynEq value) {
            return dynHash(value);
        }

        @Override
        public String toString() {
            return "TotalEquality[dyn]";
        }
    };

    private DynEqSupport() {}

    /**
     * Two handles are equal iff their concrete types are identical and the values are equal
     * under that type's {@code equals}. Two nulls are equal; null never equals a value.
     */
    public static boolean dynEquals(DynEq a, DynEq b) {
        if (a == null || b == null) return a == b;
        if (!a.dynTypeId().equals(b.dynTypeId())) return false;
        return a.dynEq(ErasedRef.erase(b));
    }

    /**
     * Hash consistent with {@link #dynEquals(DynEq, DynEq)}. Zero for null.
     */
    public static int dynHash(DynEq value) {
        if (value == null) return 0;
        return 31 * value.dynTypeId().hashCode() + value.hashCode();
    }

    /**
     * The shared total equality over any {@link DynEq} subtype.
     */
    @SuppressWarnings("unchecked")
    public static <T extends DynEq> TotalEquality<T> totalEquality() {
        return (TotalEquality<T>) TOTAL;
    }
}
