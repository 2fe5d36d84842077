package com.ethnicthv.dyneq.demo.shape;

public record Square(int side) implements Shape {
    @Override
    public double area() {
        return (double) side * side;
    }
}
