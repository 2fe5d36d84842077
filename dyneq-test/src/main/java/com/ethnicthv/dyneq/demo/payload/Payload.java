package com.ethnicthv.dyneq.demo.payload;

import com.ethnicthv.dyneq.core.DynEq;
import com.ethnicthv.dyneq.core.annotation.DynEqObject;

/**
 * Message payload handed between threads.
 */
@DynEqObject
public interface Payload extends DynEq {
    int id();
}
