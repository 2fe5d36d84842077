package com.ethnicthv.dyneq.demo.shape;

import com.ethnicthv.dyneq.core.DynEq;
import com.ethnicthv.dyneq.core.annotation.DynEqObject;

/**
 * Two structurally identical implementers: only the concrete type tells them apart.
 */
@DynEqObject(boxes = false)
public interface Numbered extends DynEq {
    int value();

    record A(int value) implements Numbered {}

    record B(int value) implements Numbered {}
}
