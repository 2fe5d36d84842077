package com.ethnicthv.dyneq.processor;

import com.ethnicthv.dyneq.processor.decl.TraitObjectDecl;

import javax.annotation.processing.Filer;
import javax.lang.model.element.Element;
import javax.tools.JavaFileObject;
import java.io.IOException;
import java.io.Writer;

/**
 * Renders {@code <Interface>Equality}: for every {@link MarkerCombination} an equality operator,
 * optionally an owning box with its factory and box-to-reference operator, and a total-equality
 * declaration.
 */
final class EqualitySourceWriter {
    private static final String SUPPORT = "com.ethnicthv.dyneq.core.DynEqSupport";
    private static final String ERASED_REF = "com.ethnicthv.dyneq.core.erasure.ErasedRef";
    private static final String TOTAL = "com.ethnicthv.dyneq.core.TotalEquality";
    private static final String DYN_BOX = "com.ethnicthv.dyneq.core.DynBox";

    private final String pkg;
    private final String className;
    private final TraitObjectDecl decl;
    private final boolean boxes;
    private final String target;
    private final String self;

    EqualitySourceWriter(String pkg, String className, TraitObjectDecl decl, boolean boxes) {
        this.pkg = pkg;
        this.className = className;
        this.decl = decl;
        this.boxes = boxes;
        this.target = decl.targetType();
        this.self = freshName("Self");
    }

    String qualifiedName() {
        return pkg.isEmpty() ? className : pkg + "." + className;
    }

    void write(Filer filer, Element origin) throws IOException {
        JavaFileObject file = filer.createSourceFile(qualifiedName(), origin);
        try (Writer w = file.openWriter()) {
            w.write(render());
        }
    }

    String render() {
        StringBuilder w = new StringBuilder();
        if (!pkg.isEmpty()) w.append("package ").append(pkg).append(";\n\n");
        w.append("@javax.annotation.processing.Generated(\"").append(DynEqProcessor.class.getName()).append("\")\n");
        w.append("@SuppressWarnings(\"all\")\n");
        w.append("public final class ").append(className).append(" {\n");
        w.append("    private ").append(className).append("() {}\n");
        for (MarkerCombination mc : MarkerCombination.values()) {
            w.append("\n    // ---- ").append(mc.name()).append("\n");
            writeOperator(w, mc);
            if (boxes) writeBox(w, mc);
            writeTotal(w, mc);
        }
        w.append("\n    public static ").append(generics()).append("int hash(").append(target).append(" value) {\n");
        w.append("        return ").append(SUPPORT).append(".dynHash(value);\n");
        w.append("    }\n");
        w.append("}\n");
        return w.toString();
    }

    // Same type identity first, then the checked compare on the erased peer.
    private void writeOperator(StringBuilder w, MarkerCombination mc) {
        String operand = operand(mc);
        w.append("    public static ").append(generics(mc)).append("boolean ").append(mc.operatorName())
                .append("(").append(operand).append(" a, ").append(operand).append(" b) {\n");
        w.append("        if (a == null || b == null) return a == b;\n");
        w.append("        if (!a.dynTypeId().equals(b.dynTypeId())) return false;\n");
        w.append("        return a.dynEq(").append(ERASED_REF).append(".erase(b));\n");
        w.append("    }\n");
    }

    private void writeBox(StringBuilder w, MarkerCombination mc) {
        String operand = operand(mc);
        String boxClass = mc.boxClassName();
        String boxType = boxClass + (mc.marked() ? decl.typeArgClause(self) : decl.typeArgClause());
        String classParams = mc.marked() ? decl.typeParamClause(self + " extends " + mc.intersection(target)) : decl.typeParamClause();

        w.append("\n    public static final class ").append(boxClass).append(classParams)
                .append(" extends ").append(DYN_BOX).append("<").append(operand).append(">");
        if (mc.marked()) w.append(" implements ").append(String.join(", ", mc.markers));
        w.append(" {\n");
        w.append("        public ").append(boxClass).append("(").append(operand).append(" value) {\n");
        w.append("            super(value);\n");
        w.append("        }\n");
        w.append("    }\n\n");

        w.append("    public static ").append(generics(mc)).append(boxType).append(" ").append(mc.boxFactoryName())
                .append("(").append(operand).append(" value) {\n");
        w.append("        return new ").append(boxClass).append(boxType.equals(boxClass) ? "" : "<>").append("(value);\n");
        w.append("    }\n\n");

        w.append("    public static ").append(generics(mc)).append("boolean ").append(mc.boxOperatorName())
                .append("(").append(boxType).append(" box, ").append(operand).append(" other) {\n");
        w.append("        return box.equalsValue(other);\n");
        w.append("    }\n");
    }

    private void writeTotal(StringBuilder w, MarkerCombination mc) {
        w.append("\n    public static ").append(generics(mc)).append(TOTAL).append("<").append(operand(mc)).append("> ")
                .append(mc.totalName()).append("() {\n");
        w.append("        return ").append(SUPPORT).append(".totalEquality();\n");
        w.append("    }\n");
    }

    private String operand(MarkerCombination mc) {
        return mc.marked() ? self : target;
    }

    // Method type parameters followed by a space, or nothing.
    private String generics(MarkerCombination mc) {
        String clause = mc.marked() ? decl.typeParamClause(self + " extends " + mc.intersection(target)) : decl.typeParamClause();
        return clause.isEmpty() ? "" : clause + " ";
    }

    private String generics() {
        return generics(MarkerCombination.NONE);
    }

    private String freshName(String base) {
        String name = base;
        for (int i = 1; decl.typeParamNames().contains(name); i++) name = base + i;
        return name;
    }
}
