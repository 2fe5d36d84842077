package com.ethnicthv.dyneq.core.erasure;

import java.util.Objects;
import java.util.Optional;

/**
 * Type-erased reference: enough to recover the runtime type identity and to attempt a
 * guarded downcast back to a named concrete type. Used by generated comparison code.
 */
public final class ErasedRef {
    private final Object ref;
    private final TypeId typeId;

    private ErasedRef(Object ref) {
        this.ref = ref;
        this.typeId = TypeId.of(ref);
    }

    public static ErasedRef erase(Object ref) {
        return new ErasedRef(Objects.requireNonNull(ref, "ref"));
    }

    public TypeId typeId() {
        return typeId;
    }

    /**
     * Recovers the reference if its runtime class is exactly {@code target}.
     *
     * @return the original reference, or empty on any other class
     */
    public <T> Optional<T> downcast(Class<T> target) {
        return Optional.ofNullable(downcastOrNull(target));
    }

    /**
     * Same as {@link #downcast(Class)} without the {@link Optional} allocation.
     */
    public <T> T downcastOrNull(Class<T> target) {
        return typeId.is(target) ? target.cast(ref) : null;
    }

    @Override
    public String toString() {
        return "ErasedRef[" + typeId.type().getName() + "]";
    }
}
