package com.ethnicthv.dyneq.core.marker;

/**
 * Marks values that may be read from several threads at once. Bookkeeping only.
 */
public interface ThreadShared {
}
