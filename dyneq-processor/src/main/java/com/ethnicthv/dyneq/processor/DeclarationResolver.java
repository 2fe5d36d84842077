package com.ethnicthv.dyneq.processor;

import com.ethnicthv.dyneq.processor.decl.ExpansionException;
import com.ethnicthv.dyneq.processor.decl.TraitObjectDecl;
import com.ethnicthv.dyneq.processor.decl.TypeParam;

import javax.lang.model.element.*;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Binds a parsed declaration to the interface element it names, and derives declarations from
 * annotated interfaces.
 */
final class DeclarationResolver {
    private final Elements elements;
    private final Types types;
    private final TypeMirror dynEq;

    DeclarationResolver(Elements elements, Types types, TypeElement dynEq) {
        this.elements = elements;
        this.types = types;
        this.dynEq = types.erasure(dynEq.asType());
    }

    record Resolved(TypeElement iface, TraitObjectDecl decl) {}

    /**
     * Declaration text equivalent to the interface's own header, e.g.
     * {@code <R extends java.lang.Readable> com.example.Difficult<R>}.
     */
    static String deriveDeclaration(TypeElement iface) {
        StringBuilder sb = new StringBuilder();
        List<? extends TypeParameterElement> params = iface.getTypeParameters();
        if (!params.isEmpty()) {
            StringJoiner decl = new StringJoiner(", ", "<", "> ");
            for (TypeParameterElement p : params) {
                List<String> bounds = new ArrayList<>();
                for (TypeMirror b : p.getBounds()) {
                    String s = b.toString();
                    if (!s.equals("java.lang.Object")) bounds.add(s);
                }
                decl.add(bounds.isEmpty() ? p.getSimpleName().toString()
                        : p.getSimpleName() + " extends " + String.join(" & ", bounds));
            }
            sb.append(decl);
        }
        sb.append(iface.getQualifiedName());
        if (!params.isEmpty()) {
            StringJoiner args = new StringJoiner(", ", "<", ">");
            for (TypeParameterElement p : params) args.add(p.getSimpleName());
            sb.append(args);
        }
        return sb.toString();
    }

    Resolved resolve(TraitObjectDecl decl, Element site) {
        String name = decl.interfaceName();
        TypeElement iface = lookup(name, site);
        if (iface == null) {
            throw new ExpansionException("cannot resolve interface '" + name + "' from "
                    + elements.getPackageOf(site).getQualifiedName());
        }
        if (iface.getKind() != ElementKind.INTERFACE) {
            throw new ExpansionException(iface.getQualifiedName() + " is not an interface");
        }
        if (!types.isAssignable(types.erasure(iface.asType()), dynEq)) {
            throw new ExpansionException(iface.getQualifiedName() + " must extend " + dynEq);
        }
        int expected = iface.getTypeParameters().size();
        if (expected != decl.typeArgs().size()) {
            throw new ExpansionException(iface.getQualifiedName() + " expects " + expected
                    + " type argument(s) but the declaration supplies " + decl.typeArgs().size());
        }
        // Generated code lives inside the holder class, where simple names may be shadowed
        TraitObjectDecl qualified = decl.withInterfaceName(iface.getQualifiedName().toString())
                .withTypeNames(n -> qualifyTypeName(n, site));
        checkBounds(iface, qualified);
        return new Resolved(iface, qualified);
    }

    private String qualifyTypeName(String name, Element site) {
        TypeElement te = lookup(name, site);
        if (te != null) return te.getQualifiedName().toString();
        for (MarkerCombination mc : MarkerCombination.values()) {
            if (mc.boxClassName().equals(name)) {
                throw new ExpansionException("cannot resolve type '" + name
                        + "'; it would be shadowed by the generated nested class " + name);
            }
        }
        // primitives in array types, or names javac will report itself
        return name;
    }

    // Erasure-level check of the type arguments against the interface's declared bounds.
    private void checkBounds(TypeElement iface, TraitObjectDecl decl) {
        List<? extends TypeParameterElement> formals = iface.getTypeParameters();
        for (int i = 0; i < formals.size(); i++) {
            String arg = decl.typeArgs().get(i);
            for (TypeMirror bound : formals.get(i).getBounds()) {
                TypeMirror required = types.erasure(bound);
                if (!satisfies(arg, required, decl)) {
                    throw new ExpansionException("type argument '" + arg + "' is not within the bound " + bound
                            + " of " + iface.getQualifiedName() + "'s parameter " + formals.get(i).getSimpleName());
                }
            }
        }
    }

    private boolean satisfies(String arg, TypeMirror required, TraitObjectDecl decl) {
        String raw = rawName(arg);
        if (raw == null) return true;
        for (TypeParam p : decl.typeParams()) {
            if (!p.name().equals(raw)) continue;
            if (p.bounds().isEmpty()) return required.toString().equals("java.lang.Object");
            for (String b : p.bounds()) {
                if (erasedSubtype(rawName(b), required)) return true;
            }
            return false;
        }
        return erasedSubtype(raw, required);
    }

    private boolean erasedSubtype(String raw, TypeMirror required) {
        if (raw == null) return true;
        TypeElement te = elements.getTypeElement(raw);
        // unknown names (other type variables) are left to javac
        if (te == null) return true;
        return types.isSubtype(types.erasure(te.asType()), required);
    }

    // Class name without type arguments, or null for wildcards and arrays.
    private static String rawName(String type) {
        if (type.startsWith("?") || type.contains("[")) return null;
        int lt = type.indexOf('<');
        return (lt < 0 ? type : type.substring(0, lt)).trim();
    }

    private TypeElement lookup(String name, Element site) {
        List<String> candidates = new ArrayList<>();
        PackageElement pkg = elements.getPackageOf(site);
        if (!pkg.isUnnamed()) candidates.add(pkg.getQualifiedName() + "." + name);
        if (site instanceof TypeElement te) candidates.add(te.getQualifiedName() + "." + name);
        candidates.add(name);
        candidates.add("java.lang." + name);
        for (String c : candidates) {
            TypeElement te = elements.getTypeElement(c);
            if (te != null && te.asType().getKind() == TypeKind.DECLARED) return te;
        }
        return null;
    }

    /**
     * Simple name of the generated holder: {@code ShapeEquality}, or {@code Outer_InnerEquality}
     * for a nested interface.
     */
    static String equalityClassName(TypeElement iface) {
        StringBuilder sb = new StringBuilder(iface.getSimpleName());
        Element cur = iface.getEnclosingElement();
        while (cur instanceof TypeElement outer) {
            sb.insert(0, outer.getSimpleName() + "_");
            cur = outer.getEnclosingElement();
        }
        return sb.append("Equality").toString();
    }
}
