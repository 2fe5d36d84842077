package com.ethnicthv.dyneq.processor.decl;

/**
 * A {@code @DynEqObject} declaration that cannot be expanded. Always reported as a compiler
 * error on the annotated element; never escapes the processor.
 */
public final class ExpansionException extends RuntimeException {
    public ExpansionException(String msg) {
        super(msg);
    }
}
