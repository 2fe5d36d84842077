package com.ethnicthv.dyneq.demo.keyed;

import com.ethnicthv.dyneq.core.DynEq;

/**
 * Generic interface declared comparable from package-info.
 */
public interface Keyed<K> extends DynEq {
    K key();
}
