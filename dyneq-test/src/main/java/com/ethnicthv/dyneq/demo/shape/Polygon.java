package com.ethnicthv.dyneq.demo.shape;

/**
 * Regular polygon written before records. Its equals accepts any Polygon subclass with the same
 * side count and length.
 */
public class Polygon implements Shape {
    private final int sides;
    private final double length;

    public Polygon(int sides, double length) {
        this.sides = sides;
        this.length = length;
    }

    @Override
    public double area() {
        return sides * length * length / (4 * Math.tan(Math.PI / sides));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Polygon that)) return false;
        return sides == that.sides && Double.compare(length, that.length) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * sides + Double.hashCode(length);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[sides=" + sides + ", length=" + length + "]";
    }
}
