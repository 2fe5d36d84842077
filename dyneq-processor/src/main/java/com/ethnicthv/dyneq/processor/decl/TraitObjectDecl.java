package com.ethnicthv.dyneq.processor.decl;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Parsed declaration: generic parameters (with {@code where} bounds already merged), the
 * interface name and the type arguments applied to it.
 *
 * @param typeParams    declared type parameters, possibly empty
 * @param interfaceName simple or qualified interface name as written, or canonical once resolved
 * @param typeArgs      type arguments applied to the interface, possibly empty
 */
public record TraitObjectDecl(List<TypeParam> typeParams, String interfaceName, List<String> typeArgs) {
    public TraitObjectDecl {
        typeParams = List.copyOf(typeParams);
        typeArgs = List.copyOf(typeArgs);
    }

    public TraitObjectDecl withInterfaceName(String name) {
        return new TraitObjectDecl(typeParams, name, typeArgs);
    }

    /**
     * Rewrites every type name in the type arguments and bounds through {@code names}. Type
     * parameter names, keywords and wildcards are left alone.
     */
    public TraitObjectDecl withTypeNames(UnaryOperator<String> names) {
        Set<String> vars = new HashSet<>(typeParamNames());
        List<TypeParam> params = new ArrayList<>();
        for (TypeParam p : typeParams) {
            List<String> bounds = new ArrayList<>();
            for (String b : p.bounds()) {
                String renamed = rename(b, vars, names);
                if (!bounds.contains(renamed)) bounds.add(renamed);
            }
            params.add(new TypeParam(p.name(), bounds));
        }
        List<String> args = new ArrayList<>();
        for (String a : typeArgs) args.add(rename(a, vars, names));
        return new TraitObjectDecl(params, interfaceName, args);
    }

    private static String rename(String type, Set<String> vars, UnaryOperator<String> names) {
        List<Token> out = new ArrayList<>();
        for (Token t : DeclarationLexer.tokenize(type)) {
            boolean typeName = t.is(Token.Kind.IDENT) && !t.isKeyword() && !vars.contains(t.text());
            out.add(typeName ? new Token(t.kind(), names.apply(t.text()), t.position()) : t);
        }
        return DeclarationParser.render(out);
    }

    /**
     * The interface as a type, e.g. {@code com.example.Difficult<R>}.
     */
    public String targetType() {
        return typeArgs.isEmpty() ? interfaceName : interfaceName + "<" + String.join(", ", typeArgs) + ">";
    }

    public List<String> typeParamNames() {
        return typeParams.stream().map(TypeParam::name).collect(Collectors.toList());
    }

    /**
     * Declarations of all type parameters plus any extra ones, e.g. {@code <R extends X, Self extends Y>},
     * or the empty string.
     */
    public String typeParamClause(String... extra) {
        List<String> all = new ArrayList<>();
        for (TypeParam p : typeParams) all.add(p.render());
        all.addAll(List.of(extra));
        return all.isEmpty() ? "" : "<" + String.join(", ", all) + ">";
    }

    /**
     * Uses of all type parameters plus any extra ones, e.g. {@code <R, Self>}, or the empty string.
     */
    public String typeArgClause(String... extra) {
        List<String> all = new ArrayList<>(typeParamNames());
        all.addAll(List.of(extra));
        return all.isEmpty() ? "" : "<" + String.join(", ", all) + ">";
    }
}
