package com.ethnicthv.dyneq.demo.shape;

import com.ethnicthv.dyneq.core.DynEq;
import com.ethnicthv.dyneq.core.annotation.DynEqObject;

/**
 * Geometric shape compared through {@link ShapeEquality}.
 */
@DynEqObject
public interface Shape extends DynEq {
    double area();
}
