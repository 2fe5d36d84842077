package com.ethnicthv.dyneq.demo.shape;

public final class Triangle extends Polygon {
    public Triangle(double length) {
        super(3, length);
    }
}
