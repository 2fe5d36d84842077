package com.ethnicthv.dyneq.demo;

import com.ethnicthv.dyneq.core.TotalEquality;
import com.ethnicthv.dyneq.demo.shape.*;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Generated ShapeEquality / NumberedEquality")
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
public class ShapeEqualityTest {

    private static final List<Shape> SHAPES = List.of(
            new Circle(1), new Circle(1), new Circle(2),
            new Square(1), new Square(2),
            new Polygon(3, 1.0), new Triangle(1.0), new Triangle(1.0), new Triangle(2.0));

    @Test
    @Order(1)
    @DisplayName("TC-EQ-001: A{5} vs A{5} is equal")
    void sameTypeSameValue() {
        Numbered a = new Numbered.A(5);
        Numbered aBis = new Numbered.A(5);
        assertTrue(NumberedEquality.eq(a, aBis), "same type and value must be equal");
    }

    @Test
    @Order(2)
    @DisplayName("TC-EQ-002: A{5} vs A{10} is not equal")
    void sameTypeDifferentValue() {
        assertFalse(NumberedEquality.eq(new Numbered.A(5), new Numbered.A(10)));
    }

    @Test
    @Order(3)
    @DisplayName("TC-EQ-003: A{5} vs B{5} is not equal, type dominates value")
    void differentTypeSameValue() {
        assertFalse(NumberedEquality.eq(new Numbered.A(5), new Numbered.B(5)));
        assertFalse(NumberedEquality.eq(new Numbered.B(5), new Numbered.A(5)));
    }

    @Test
    @Order(4)
    @DisplayName("TC-EQ-004: A{5} vs B{10} is not equal")
    void differentTypeDifferentValue() {
        assertFalse(NumberedEquality.eq(new Numbered.A(5), new Numbered.B(10)));
    }

    @Test
    @Order(5)
    @DisplayName("TC-EQ-005: a lax equals across subclasses does not leak through")
    void laxNativeEquals() {
        Shape polygon = new Polygon(3, 1.0);
        Shape triangle = new Triangle(1.0);
        assertEquals(polygon, triangle, "native equals accepts the subclass");
        assertFalse(ShapeEquality.eq(polygon, triangle), "different concrete types");
        assertTrue(ShapeEquality.eq(triangle, new Triangle(1.0)));
    }

    @Test
    @Order(6)
    @DisplayName("TC-EQ-006: reflexive, symmetric, transitive and consistent with native equality")
    void equivalenceRelation() {
        for (Shape x : SHAPES) {
            assertTrue(ShapeEquality.eq(x, x), () -> "not reflexive: " + x);
            for (Shape y : SHAPES) {
                boolean xy = ShapeEquality.eq(x, y);
                assertEquals(xy, ShapeEquality.eq(y, x), () -> "not symmetric: " + x + ", " + y);
                assertEquals(x.getClass() == y.getClass() && x.equals(y), xy, () -> x + " vs " + y);
                if (xy) assertEquals(ShapeEquality.hash(x), ShapeEquality.hash(y));
                for (Shape z : SHAPES) {
                    if (xy && ShapeEquality.eq(y, z)) {
                        assertTrue(ShapeEquality.eq(x, z), () -> "not transitive: " + x + ", " + y + ", " + z);
                    }
                }
            }
        }
    }

    @Test
    @Order(7)
    @DisplayName("TC-EQ-007: null handles")
    void nullHandles() {
        assertTrue(ShapeEquality.eq(null, null));
        assertFalse(ShapeEquality.eq(new Circle(1), null));
        assertFalse(ShapeEquality.eq(null, new Circle(1)));
    }

    @Test
    @Order(8)
    @DisplayName("TC-EQ-008: the totality declaration agrees with the operator")
    void totalEquality() {
        TotalEquality<Shape> total = ShapeEquality.total();
        for (Shape x : SHAPES) {
            for (Shape y : SHAPES) {
                assertEquals(ShapeEquality.eq(x, y), total.equivalent(x, y));
            }
            assertEquals(ShapeEquality.hash(x), total.hash(x));
        }
    }

    @Test
    @Order(9)
    @DisplayName("TC-EQ-009: boxes compare against boxes and bare references")
    void boxes() {
        ShapeEquality.Box circle = ShapeEquality.box(new Circle(3));
        assertEquals(circle, ShapeEquality.box(new Circle(3)));
        assertNotEquals(circle, ShapeEquality.box(new Square(3)));
        assertEquals(circle.hashCode(), ShapeEquality.box(new Circle(3)).hashCode());
        assertTrue(ShapeEquality.eqBox(circle, new Circle(3)));
        assertFalse(ShapeEquality.eqBox(circle, new Circle(4)));
        assertSame(circle.get(), circle.get());
    }
}
