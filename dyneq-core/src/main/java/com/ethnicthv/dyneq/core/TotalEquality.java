package com.ethnicthv.dyneq.core;

/**
 * Equality over {@code T} that is a total equivalence relation (reflexive, symmetric and
 * transitive for every value), together with a hash consistent with it.
 *
 * @param <T> compared type
 */
public interface TotalEquality<T> {

    boolean equivalent(T a, T b);

    int hash(T value);
}
