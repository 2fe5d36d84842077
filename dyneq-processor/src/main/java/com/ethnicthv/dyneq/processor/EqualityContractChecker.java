package com.ethnicthv.dyneq.processor;

import javax.lang.model.element.*;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Types;
import java.util.List;
import java.util.function.Consumer;

/**
 * Compile-time sealing of {@code DynEq}: concrete implementers must have native equality, and
 * nobody but {@code DynEq} itself may declare its methods.
 */
final class EqualityContractChecker {
    static final String DYN_EQ = "com.ethnicthv.dyneq.core.DynEq";

    interface Sink {
        void error(Element e, String fmt, Object... args);
        void warn(Element e, String fmt, Object... args);
    }

    private final Types types;
    private final TypeElement dynEqElement;
    private final TypeMirror dynEq;
    private final ProcessorOptions.HashCodeCheck hashCodeCheck;
    private final Sink sink;
    private int checked;

    EqualityContractChecker(Types types, TypeElement dynEqElement, ProcessorOptions.HashCodeCheck hashCodeCheck, Sink sink) {
        this.types = types;
        this.dynEqElement = dynEqElement;
        this.dynEq = types.erasure(dynEqElement.asType());
        this.hashCodeCheck = hashCodeCheck;
        this.sink = sink;
    }

    int checkedCount() {
        return checked;
    }

    void check(Element root) {
        forEachType(root, this::checkType);
    }

    private static void forEachType(Element e, Consumer<TypeElement> action) {
        if (!(e instanceof TypeElement te)) return;
        action.accept(te);
        for (Element inner : te.getEnclosedElements()) forEachType(inner, action);
    }

    private void checkType(TypeElement te) {
        if (te.equals(dynEqElement)) return;
        if (!types.isAssignable(types.erasure(te.asType()), dynEq)) return;
        checked++;
        for (Element m : te.getEnclosedElements()) {
            if (m.getKind() != ElementKind.METHOD) continue;
            ExecutableElement ee = (ExecutableElement) m;
            String name = ee.getSimpleName().toString();
            int arity = ee.getParameters().size();
            if ((name.equals("dynEq") && arity == 1) || (name.equals("dynTypeId") && arity == 0)) {
                sink.error(ee, "%s.%s must not be overridden: DynEq is implemented automatically for types with native equality",
                        te.getQualifiedName(), name);
            }
        }
        ElementKind kind = te.getKind();
        if (kind == ElementKind.INTERFACE || kind == ElementKind.ANNOTATION_TYPE) return;
        if (kind == ElementKind.RECORD || kind == ElementKind.ENUM) return;
        if (te.getModifiers().contains(Modifier.ABSTRACT)) return;

        ExecutableElement equals = findInHierarchy(te, "equals", "java.lang.Object");
        if (equals == null) {
            sink.error(te, "%s implements DynEq but has no native equality: declare equals(Object) (or use a record)",
                    te.getQualifiedName());
            return;
        }
        if (hashCodeCheck == ProcessorOptions.HashCodeCheck.OFF) return;
        if (findInHierarchy(te, "hashCode", null) == null) {
            String msg = "%s declares equals(Object) without hashCode(); dynamic hashing will be inconsistent";
            if (hashCodeCheck == ProcessorOptions.HashCodeCheck.ERROR) sink.error(te, msg, te.getQualifiedName());
            else sink.warn(te, msg, te.getQualifiedName());
        }
    }

    /**
     * Finds a concrete method declared by the type or a superclass below {@code java.lang.Object}.
     *
     * @param paramType single parameter type, or null for a no-arg method
     */
    private ExecutableElement findInHierarchy(TypeElement te, String name, String paramType) {
        TypeElement cur = te;
        while (cur != null && !cur.getQualifiedName().contentEquals("java.lang.Object")) {
            for (Element m : cur.getEnclosedElements()) {
                if (m.getKind() != ElementKind.METHOD || !m.getSimpleName().contentEquals(name)) continue;
                ExecutableElement ee = (ExecutableElement) m;
                if (ee.getModifiers().contains(Modifier.ABSTRACT) || ee.getModifiers().contains(Modifier.STATIC)) continue;
                List<? extends VariableElement> params = ee.getParameters();
                if (paramType == null ? params.isEmpty()
                        : params.size() == 1 && types.erasure(params.get(0).asType()).toString().equals(paramType)) {
                    return ee;
                }
            }
            TypeMirror sup = cur.getSuperclass();
            cur = sup.getKind() == TypeKind.DECLARED ? (TypeElement) types.asElement(sup) : null;
        }
        return null;
    }
}
