package com.ethnicthv.dyneq.processor;

import com.ethnicthv.dyneq.processor.decl.DeclarationParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Generated equality source")
public class EqualitySourceWriterTest {

    private static String render(String decl, boolean boxes) {
        return new EqualitySourceWriter("com.example", "ShapeEquality", DeclarationParser.parse(decl), boxes).render();
    }

    @Test
    @DisplayName("One operator and one totality declaration per marker combination")
    void operatorsForEveryCombination() {
        String src = render("com.example.Shape", false);
        assertTrue(src.startsWith("package com.example;"));
        assertTrue(src.contains("public static boolean eq(com.example.Shape a, com.example.Shape b)"), src);
        assertTrue(src.contains("public static <Self extends com.example.Shape & com.ethnicthv.dyneq.core.marker.ThreadMovable> boolean eqMovable(Self a, Self b)"), src);
        assertTrue(src.contains("public static <Self extends com.example.Shape & com.ethnicthv.dyneq.core.marker.ThreadShared> boolean eqShared(Self a, Self b)"), src);
        assertTrue(src.contains("public static <Self extends com.example.Shape & com.ethnicthv.dyneq.core.marker.ThreadMovable & com.ethnicthv.dyneq.core.marker.ThreadShared> boolean eqMovableShared(Self a, Self b)"), src);
        for (String total : new String[]{"total()", "totalMovable()", "totalShared()", "totalMovableShared()"}) {
            assertTrue(src.contains(total), total);
        }
        assertTrue(src.contains("public static int hash(com.example.Shape value)"), src);
        assertFalse(src.contains("Box"), "boxes disabled");
    }

    @Test
    @DisplayName("Identity is compared before the erased peer")
    void comparisonBody() {
        String src = render("com.example.Shape", false);
        int identity = src.indexOf("if (!a.dynTypeId().equals(b.dynTypeId())) return false;");
        int erase = src.indexOf("return a.dynEq(com.ethnicthv.dyneq.core.erasure.ErasedRef.erase(b));");
        assertTrue(identity > 0 && erase > identity, src);
    }

    @Test
    @DisplayName("Boxes, factories and box operators per combination")
    void boxes() {
        String src = render("com.example.Shape", true);
        assertTrue(src.contains("public static final class Box extends com.ethnicthv.dyneq.core.DynBox<com.example.Shape> {"), src);
        assertTrue(src.contains("public static final class MovableBox<Self extends com.example.Shape & com.ethnicthv.dyneq.core.marker.ThreadMovable> extends com.ethnicthv.dyneq.core.DynBox<Self> implements com.ethnicthv.dyneq.core.marker.ThreadMovable {"), src);
        assertTrue(src.contains("implements com.ethnicthv.dyneq.core.marker.ThreadMovable, com.ethnicthv.dyneq.core.marker.ThreadShared {"), src);
        assertTrue(src.contains("public static Box box(com.example.Shape value) {\n        return new Box(value);"), src);
        assertTrue(src.contains("MovableBox<Self> movableBox(Self value) {\n        return new MovableBox<>(value);"), src);
        assertTrue(src.contains("public static boolean eqBox(Box box, com.example.Shape other)"), src);
        assertTrue(src.contains("boolean eqMovableSharedBox(MovableSharedBox<Self> box, Self other)"), src);
    }

    @Test
    @DisplayName("Generic declarations thread their parameters everywhere")
    void generics() {
        String src = render("<R> com.example.Difficult<R> where R extends java.lang.Readable", true);
        assertTrue(src.contains("public static <R extends java.lang.Readable> boolean eq(com.example.Difficult<R> a, com.example.Difficult<R> b)"), src);
        assertTrue(src.contains("public static <R extends java.lang.Readable, Self extends com.example.Difficult<R> & com.ethnicthv.dyneq.core.marker.ThreadShared> boolean eqShared(Self a, Self b)"), src);
        assertTrue(src.contains("public static final class Box<R extends java.lang.Readable> extends com.ethnicthv.dyneq.core.DynBox<com.example.Difficult<R>> {"), src);
        assertTrue(src.contains("Box<R> box(com.example.Difficult<R> value) {\n        return new Box<>(value);"), src);
        assertTrue(src.contains("SharedBox<R, Self> sharedBox(Self value)"), src);
    }

    @Test
    @DisplayName("The self variable avoids declared parameter names")
    void freshSelfName() {
        String src = render("<Self> com.example.Difficult<Self>", false);
        assertTrue(src.contains("<Self, Self1 extends com.example.Difficult<Self> & com.ethnicthv.dyneq.core.marker.ThreadMovable> boolean eqMovable(Self1 a, Self1 b)"), src);
    }

    @Test
    void qualifiedNameIncludesPackage() {
        assertEquals("com.example.ShapeEquality",
                new EqualitySourceWriter("com.example", "ShapeEquality", DeclarationParser.parse("Shape"), true).qualifiedName());
        assertEquals("ShapeEquality",
                new EqualitySourceWriter("", "ShapeEquality", DeclarationParser.parse("Shape"), true).qualifiedName());
    }
}
