package com.ethnicthv.dyneq.demo.shape;

/**
 * Aggregate holding an interface-typed field; its derived equality goes through the box.
 */
public record Scene(String name, ShapeEquality.Box shape) {
    public static Scene of(String name, Shape shape) {
        return new Scene(name, ShapeEquality.box(shape));
    }
}
