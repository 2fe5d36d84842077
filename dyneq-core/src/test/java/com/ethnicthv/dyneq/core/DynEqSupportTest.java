package com.ethnicthv.dyneq.core;

import com.ethnicthv.dyneq.core.erasure.ErasedRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Dynamic equality through the interface")
public class DynEqSupportTest {

    private static final List<Valued> SAMPLES = List.of(
            new Valued.A(5), new Valued.A(5), new Valued.A(10),
            new Valued.B(5), new Valued.B(10),
            new Valued.LaxA(5), new Valued.LaxA(5), new Valued.LaxB(5));

    @Test
    @DisplayName("Same type, same value: equal")
    void sameTypeSameValue() {
        assertTrue(DynEqSupport.dynEquals(new Valued.A(5), new Valued.A(5)));
    }

    @Test
    @DisplayName("Same type, different value: not equal")
    void sameTypeDifferentValue() {
        assertFalse(DynEqSupport.dynEquals(new Valued.A(5), new Valued.A(10)));
    }

    @Test
    @DisplayName("Different type, same value: not equal")
    void differentTypeSameValue() {
        assertFalse(DynEqSupport.dynEquals(new Valued.A(5), new Valued.B(5)));
    }

    @Test
    @DisplayName("Different type, different value: not equal")
    void differentTypeDifferentValue() {
        assertFalse(DynEqSupport.dynEquals(new Valued.A(5), new Valued.B(10)));
    }

    @Test
    @DisplayName("Type identity dominates a lax native equals")
    void typeDominatesLaxEquals() {
        Valued a = new Valued.LaxA(5);
        Valued b = new Valued.LaxB(5);
        assertEquals(a, b, "native equals treats both as equal");
        assertFalse(DynEqSupport.dynEquals(a, b));
        assertFalse(DynEqSupport.dynEquals(b, a));
        assertTrue(DynEqSupport.dynEquals(a, new Valued.LaxA(5)));
    }

    @Test
    @DisplayName("Reflexive for every sample")
    void reflexive() {
        for (Valued x : SAMPLES) {
            assertTrue(DynEqSupport.dynEquals(x, x), () -> "not reflexive for " + x);
        }
    }

    @Test
    @DisplayName("Symmetric and equal to native equality within a type")
    void symmetricAndMatchesNativeEquality() {
        for (Valued x : SAMPLES) {
            for (Valued y : SAMPLES) {
                boolean xy = DynEqSupport.dynEquals(x, y);
                assertEquals(xy, DynEqSupport.dynEquals(y, x), () -> x + " vs " + y);
                if (x.getClass() == y.getClass()) {
                    assertEquals(x.equals(y), xy, () -> x + " vs " + y);
                } else {
                    assertFalse(xy, () -> x + " vs " + y);
                }
            }
        }
    }

    @Test
    @DisplayName("Transitive over all sample triples")
    void transitive() {
        for (Valued x : SAMPLES) {
            for (Valued y : SAMPLES) {
                for (Valued z : SAMPLES) {
                    if (DynEqSupport.dynEquals(x, y) && DynEqSupport.dynEquals(y, z)) {
                        assertTrue(DynEqSupport.dynEquals(x, z), () -> x + ", " + y + ", " + z);
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("Null handles equal only each other")
    void nullHandles() {
        assertTrue(DynEqSupport.dynEquals(null, null));
        assertFalse(DynEqSupport.dynEquals(new Valued.A(5), null));
        assertFalse(DynEqSupport.dynEquals(null, new Valued.A(5)));
        assertEquals(0, DynEqSupport.dynHash(null));
    }

    @Test
    @DisplayName("Checked compare rejects a peer of another type")
    void checkedCompareRejectsMismatch() {
        Valued a = new Valued.A(5);
        assertFalse(a.dynEq(ErasedRef.erase(new Valued.B(5))));
        assertFalse(a.dynEq(ErasedRef.erase("not a Valued")));
        assertTrue(a.dynEq(ErasedRef.erase(new Valued.A(5))));
    }

    @Test
    @DisplayName("Hash is consistent with equality")
    void hashConsistent() {
        for (Valued x : SAMPLES) {
            for (Valued y : SAMPLES) {
                if (DynEqSupport.dynEquals(x, y)) {
                    assertEquals(DynEqSupport.dynHash(x), DynEqSupport.dynHash(y), () -> x + " vs " + y);
                }
            }
        }
    }

    @Test
    @DisplayName("Total equality delegates to the dynamic comparison")
    void totalEquality() {
        TotalEquality<Valued> total = DynEqSupport.totalEquality();
        assertTrue(total.equivalent(new Valued.B(10), new Valued.B(10)));
        assertFalse(total.equivalent(new Valued.B(10), new Valued.A(10)));
        assertEquals(DynEqSupport.dynHash(new Valued.A(3)), total.hash(new Valued.A(3)));
        assertSame(total, DynEqSupport.<Valued.A>totalEquality());
    }
}
