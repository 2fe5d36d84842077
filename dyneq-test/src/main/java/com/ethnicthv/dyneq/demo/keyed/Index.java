package com.ethnicthv.dyneq.demo.keyed;

import java.util.Map;

/**
 * Lookup table keyed by interface-typed keys.
 */
public record Index(String name, Map<KeyedEquality.Box<String>, Integer> entries) {
    public Index {
        entries = Map.copyOf(entries);
    }

    public Integer lookup(Keyed<String> key) {
        return entries.get(KeyedEquality.box(key));
    }
}
