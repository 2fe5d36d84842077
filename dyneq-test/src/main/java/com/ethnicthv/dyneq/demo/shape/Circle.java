package com.ethnicthv.dyneq.demo.shape;

public record Circle(int radius) implements Shape {
    @Override
    public double area() {
        return Math.PI * radius * radius;
    }
}
