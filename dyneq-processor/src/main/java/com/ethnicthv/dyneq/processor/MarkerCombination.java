package com.ethnicthv.dyneq.processor;

import java.util.List;

/**
 * The four combinations of thread markers every generated operator is emitted for.
 */
enum MarkerCombination {
    NONE("", List.of()),
    MOVABLE("Movable", List.of(MarkerCombination.THREAD_MOVABLE)),
    SHARED("Shared", List.of(MarkerCombination.THREAD_SHARED)),
    MOVABLE_SHARED("MovableShared", List.of(MarkerCombination.THREAD_MOVABLE, MarkerCombination.THREAD_SHARED));

    static final String THREAD_MOVABLE = "com.ethnicthv.dyneq.core.marker.ThreadMovable";
    static final String THREAD_SHARED = "com.ethnicthv.dyneq.core.marker.ThreadShared";

    final String suffix;
    final List<String> markers;

    MarkerCombination(String suffix, List<String> markers) {
        this.suffix = suffix;
        this.markers = markers;
    }

    boolean marked() {
        return !markers.isEmpty();
    }

    String operatorName() {
        return "eq" + suffix;
    }

    String boxClassName() {
        return suffix + "Box";
    }

    String boxFactoryName() {
        return suffix.isEmpty() ? "box" : Character.toLowerCase(suffix.charAt(0)) + suffix.substring(1) + "Box";
    }

    String boxOperatorName() {
        return "eq" + suffix + "Box";
    }

    String totalName() {
        return "total" + suffix;
    }

    /**
     * {@code Target & Marker1 & Marker2}, used as the bound of the {@code Self} variable.
     */
    String intersection(String target) {
        StringBuilder sb = new StringBuilder(target);
        for (String m : markers) sb.append(" & ").append(m);
        return sb.toString();
    }
}
