package com.ethnicthv.dyneq.core.erasure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Type erasure bridge")
public class ErasedRefTest {

    @Test
    @DisplayName("Downcast to the right type returns the original reference")
    void roundTrip() {
        String s = "hello";
        ErasedRef erased = ErasedRef.erase(s);
        Optional<String> back = erased.downcast(String.class);
        assertTrue(back.isPresent());
        assertSame(s, back.get());
        assertSame(s, erased.downcastOrNull(String.class));
    }

    @Test
    @DisplayName("Downcast to a wrong type is rejected without throwing")
    void wrongTarget() {
        ErasedRef erased = ErasedRef.erase(42);
        assertTrue(erased.downcast(String.class).isEmpty());
        assertNull(erased.downcastOrNull(Long.class));
    }

    @Test
    @DisplayName("Downcast requires the exact runtime class")
    void supertypeRejected() {
        ErasedRef erased = ErasedRef.erase(new ArrayList<String>());
        assertTrue(erased.downcast(List.class).isEmpty(), "interface target must not match");
        assertTrue(erased.downcast(Object.class).isEmpty(), "supertype target must not match");
        assertTrue(erased.downcast(ArrayList.class).isPresent());
    }

    @Test
    void typeIdOfErasedValue() {
        assertEquals(TypeId.of(Integer.class), ErasedRef.erase(7).typeId());
    }

    @Test
    void nullCannotBeErased() {
        assertThrows(NullPointerException.class, () -> ErasedRef.erase(null));
    }
}
