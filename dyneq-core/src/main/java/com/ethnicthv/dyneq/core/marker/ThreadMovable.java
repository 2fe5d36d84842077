package com.ethnicthv.dyneq.core.marker;

/**
 * Marks values that may be handed over to another thread. Bookkeeping only; generated
 * comparisons for {@code I & ThreadMovable} behave exactly as for {@code I}.
 */
public interface ThreadMovable {
}
