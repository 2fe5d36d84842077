package com.ethnicthv.dyneq.benchmark;

import com.ethnicthv.dyneq.demo.shape.Circle;
import com.ethnicthv.dyneq.demo.shape.Shape;
import com.ethnicthv.dyneq.demo.shape.ShapeEquality;
import com.ethnicthv.dyneq.demo.shape.Square;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

/**
 * Microbenchmarks of generated dynamic equality against plain {@code equals}:
 * - same concrete type (identity check, erase, downcast, equals)
 * - different concrete types (identity check only)
 * - boxed comparison
 * - a mixed pass over all shapes, sunk into a Blackhole
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms1G", "-Xmx1G"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class DynEqBenchmark {

    @State(Scope.Thread)
    public static class Operands {
        public Shape circle;
        public Shape circleBis;
        public Shape square;
        public ShapeEquality.Box circleBox;
        public ShapeEquality.Box circleBoxBis;
        public Shape[] all;

        @Setup(Level.Trial)
        public void setup() {
            circle = new Circle(5);
            circleBis = new Circle(5);
            square = new Square(5);
            circleBox = ShapeEquality.box(circle);
            circleBoxBis = ShapeEquality.box(circleBis);
            all = new Shape[]{circle, circleBis, square, new Square(7), new Circle(7)};
        }
    }

    @Benchmark
    public boolean nativeEqualsSameType(Operands s) {
        return s.circle.equals(s.circleBis);
    }

    @Benchmark
    public boolean dynEqSameType(Operands s) {
        return ShapeEquality.eq(s.circle, s.circleBis);
    }

    @Benchmark
    public boolean dynEqDifferentType(Operands s) {
        return ShapeEquality.eq(s.circle, s.square);
    }

    @Benchmark
    public boolean boxedEquals(Operands s) {
        return s.circleBox.equals(s.circleBoxBis);
    }

    @Benchmark
    public int dynHash(Operands s) {
        return ShapeEquality.hash(s.circle);
    }

    @Benchmark
    public void mixedPairs(Operands s, Blackhole bh) {
        Shape[] all = s.all;
        for (int i = 0; i < all.length; i++) {
            bh.consume(ShapeEquality.hash(all[i]));
            for (int j = 0; j < all.length; j++) {
                bh.consume(ShapeEquality.eq(all[i], all[j]));
            }
        }
    }
}
