package com.ethnicthv.dyneq.core.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Generates {@code <Interface>Equality} for an interface extending
 * {@link com.ethnicthv.dyneq.core.DynEq}: one equality operator, one optional owning box and
 * one total-equality declaration for each combination of
 * {@link com.ethnicthv.dyneq.core.marker.ThreadMovable} and
 * {@link com.ethnicthv.dyneq.core.marker.ThreadShared}.
 * <p>
 * On an interface with no {@link #value()}, the interface itself is used. Otherwise the value
 * is a declaration, resolved against the annotated element's package:
 * <pre>{@code
 * @DynEqObject("<R> Difficult<R> where R extends java.lang.Readable")
 * package com.example;
 * }</pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.PACKAGE})
@Repeatable(DynEqObject.List.class)
public @interface DynEqObject {
    /**
     * Declaration {@code [<generics>] Path[<args>] [where P extends Bound (& Bound)*, ...]}.
     * Empty means the annotated interface.
     */
    String value() default "";

    /**
     * Whether owning boxes are generated. Also subject to the {@code dyneq.boxes} option.
     */
    boolean boxes() default true;

    @Retention(RetentionPolicy.RUNTIME)
    @Target({ElementType.TYPE, ElementType.PACKAGE})
    @interface List {
        DynEqObject[] value();
    }
}
