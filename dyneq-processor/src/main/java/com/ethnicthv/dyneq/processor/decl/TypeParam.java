package com.ethnicthv.dyneq.processor.decl;

import java.util.ArrayList;
import java.util.List;

/**
 * A declared type parameter and its bounds, as source text.
 */
public record TypeParam(String name, List<String> bounds) {
    public TypeParam {
        bounds = List.copyOf(bounds);
    }

    TypeParam withExtraBounds(List<String> extra) {
        List<String> all = new ArrayList<>(bounds);
        for (String b : extra) if (!all.contains(b)) all.add(b);
        return new TypeParam(name, all);
    }

    public String render() {
        return bounds.isEmpty() ? name : name + " extends " + String.join(" & ", bounds);
    }
}
