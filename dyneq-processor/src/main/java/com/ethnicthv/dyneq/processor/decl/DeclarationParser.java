package com.ethnicthv.dyneq.processor.decl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses {@code [<generics>] Path[<args>] [where P extends Bound (& Bound)*, ...]}.
 * <p>
 * The token stream is consumed by a small state machine:
 * <ul>
 *   <li>BEGIN: a leading {@code <} opens the generic parameter list, anything else starts the path;</li>
 *   <li>GENERICS: tokens are collected until the {@code >} closing the list at depth zero;</li>
 *   <li>PATH: tokens are collected until the end or a {@code where} keyword, the rest being bounds;</li>
 *   <li>IMPL: the collected parts are validated and assembled.</li>
 * </ul>
 * Each part is then checked against a small type grammar.
 */
public final class DeclarationParser {

    private enum State { BEGIN, GENERICS, PATH, IMPL }

    private DeclarationParser() {}

    public static TraitObjectDecl parse(String text) {
        List<Token> tokens = DeclarationLexer.tokenize(text);
        List<Token> generics = new ArrayList<>();
        List<Token> path = new ArrayList<>();
        List<Token> where = new ArrayList<>();
        boolean hasGenerics = false;
        boolean hasWhere = false;

        State state = State.BEGIN;
        int i = 0;
        int depth = 0;
        while (state != State.IMPL) {
            switch (state) {
                case BEGIN -> {
                    if (tokens.isEmpty()) throw new ExpansionException("empty declaration");
                    if (tokens.get(0).is(Token.Kind.LT)) {
                        hasGenerics = true;
                        i++;
                        state = State.GENERICS;
                    } else {
                        state = State.PATH;
                    }
                }
                case GENERICS -> {
                    if (i >= tokens.size()) {
                        throw new ExpansionException("unbalanced generics: missing '>' in \"" + text + "\"");
                    }
                    Token t = tokens.get(i++);
                    if (t.is(Token.Kind.LT)) {
                        depth++;
                        generics.add(t);
                    } else if (t.is(Token.Kind.GT)) {
                        if (depth == 0) {
                            state = State.PATH;
                        } else {
                            depth--;
                            generics.add(t);
                        }
                    } else {
                        generics.add(t);
                    }
                }
                case PATH -> {
                    if (i >= tokens.size()) {
                        state = State.IMPL;
                    } else if (tokens.get(i).isWord("where")) {
                        hasWhere = true;
                        where.addAll(tokens.subList(i + 1, tokens.size()));
                        i = tokens.size();
                        state = State.IMPL;
                    } else {
                        path.add(tokens.get(i++));
                    }
                }
                default -> throw new IllegalStateException(state.name());
            }
        }

        List<TypeParam> params = hasGenerics ? parseTypeParams(generics) : List.of();
        if (path.isEmpty()) throw new ExpansionException("missing interface path in \"" + text + "\"");
        checkBalanced(path, "interface path");
        if (new TypeGrammar(path, false).parseType(0) != path.size()) {
            throw new ExpansionException("unparsable interface path '" + render(path) + "'");
        }
        String name = path.get(0).text();
        List<String> args = new ArrayList<>();
        if (path.size() > 1) {
            for (List<Token> arg : splitTopLevel(path.subList(2, path.size() - 1), Token.Kind.COMMA, "type argument")) {
                args.add(render(arg));
            }
        }
        if (hasWhere) params = mergeWhere(params, where);
        return new TraitObjectDecl(params, name, args);
    }

    // ---------------------------------------------------------------------
    // Parts
    // ---------------------------------------------------------------------
    private static List<TypeParam> parseTypeParams(List<Token> tokens) {
        if (tokens.isEmpty()) throw new ExpansionException("empty generic parameter list");
        checkBalanced(tokens, "generic parameter list");
        Map<String, TypeParam> out = new LinkedHashMap<>();
        for (List<Token> seg : splitTopLevel(tokens, Token.Kind.COMMA, "type parameter")) {
            TypeParam p = parseBounded(seg, "type parameter");
            if (out.putIfAbsent(p.name(), p) != null) {
                throw new ExpansionException("duplicate type parameter '" + p.name() + "'");
            }
        }
        return new ArrayList<>(out.values());
    }

    private static List<TypeParam> mergeWhere(List<TypeParam> params, List<Token> tokens) {
        if (tokens.isEmpty()) throw new ExpansionException("empty where clause");
        checkBalanced(tokens, "where clause");
        Map<String, TypeParam> byName = new LinkedHashMap<>();
        for (TypeParam p : params) byName.put(p.name(), p);
        for (List<Token> seg : splitTopLevel(tokens, Token.Kind.COMMA, "where bound")) {
            TypeParam bound = parseBounded(seg, "where bound");
            if (bound.bounds().isEmpty()) {
                throw new ExpansionException("where bound on '" + bound.name() + "' has no 'extends' clause");
            }
            TypeParam declared = byName.get(bound.name());
            if (declared == null) {
                throw new ExpansionException("where clause names undeclared type parameter '" + bound.name() + "'");
            }
            byName.put(bound.name(), declared.withExtraBounds(bound.bounds()));
        }
        return new ArrayList<>(byName.values());
    }

    // Ident [extends Bound (& Bound)*]
    private static TypeParam parseBounded(List<Token> seg, String what) {
        Token first = seg.get(0);
        if (!first.is(Token.Kind.IDENT) || first.isKeyword() || first.text().contains(".")) {
            throw new ExpansionException("malformed " + what + " '" + render(seg) + "'");
        }
        if (seg.size() == 1) return new TypeParam(first.text(), List.of());
        if (!seg.get(1).isWord("extends") || seg.size() == 2) {
            throw new ExpansionException("malformed " + what + " '" + render(seg) + "'");
        }
        List<String> bounds = new ArrayList<>();
        for (List<Token> b : splitTopLevel(seg.subList(2, seg.size()), Token.Kind.AMP, "bound")) {
            if (new TypeGrammar(b, false).parseType(0) != b.size()) {
                throw new ExpansionException("malformed bound '" + render(b) + "' on '" + first.text() + "'");
            }
            bounds.add(render(b));
        }
        return new TypeParam(first.text(), bounds);
    }

    // ---------------------------------------------------------------------
    // Token utilities
    // ---------------------------------------------------------------------
    static void checkBalanced(List<Token> tokens, String what) {
        int angle = 0;
        int square = 0;
        for (Token t : tokens) {
            switch (t.kind()) {
                case LT -> angle++;
                case GT -> angle--;
                case LBRACKET -> square++;
                case RBRACKET -> square--;
                default -> { }
            }
            if (angle < 0 || square < 0) {
                throw new ExpansionException("unbalanced brackets in " + what + " at position " + t.position());
            }
        }
        if (angle != 0 || square != 0) throw new ExpansionException("unbalanced brackets in " + what);
    }

    static List<List<Token>> splitTopLevel(List<Token> tokens, Token.Kind separator, String what) {
        List<List<Token>> out = new ArrayList<>();
        List<Token> cur = new ArrayList<>();
        int depth = 0;
        for (Token t : tokens) {
            if (t.is(Token.Kind.LT)) depth++;
            else if (t.is(Token.Kind.GT)) depth--;
            if (depth == 0 && t.is(separator)) {
                if (cur.isEmpty()) throw new ExpansionException("empty " + what);
                out.add(cur);
                cur = new ArrayList<>();
            } else {
                cur.add(t);
            }
        }
        if (cur.isEmpty()) throw new ExpansionException("empty " + what);
        out.add(cur);
        return out;
    }

    /**
     * Renders tokens back to source text: {@code java.util.Map<K, ? extends V>}.
     */
    static String render(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        Token prev = null;
        for (Token t : tokens) {
            if (prev != null) {
                boolean words = (prev.is(Token.Kind.IDENT) || prev.is(Token.Kind.QUESTION))
                        && (t.is(Token.Kind.IDENT) || t.is(Token.Kind.QUESTION));
                if (words || prev.is(Token.Kind.COMMA) || prev.is(Token.Kind.AMP) || t.is(Token.Kind.AMP)) sb.append(' ');
            }
            sb.append(t.text());
            prev = t;
        }
        return sb.toString();
    }

    /**
     * Recursive descent over {@code Type := Ident [< Arg (, Arg)* >] ([ ])*},
     * {@code Arg := Type | ? [(extends|super) Type]}.
     */
    private static final class TypeGrammar {
        private final List<Token> ts;
        private final boolean arrays;

        TypeGrammar(List<Token> ts, boolean arrays) {
            this.ts = ts;
            this.arrays = arrays;
        }

        /** @return index after the type, or -1 when malformed */
        int parseType(int i) {
            if (i < 0 || i >= ts.size()) return -1;
            Token head = ts.get(i);
            if (!head.is(Token.Kind.IDENT) || head.isKeyword()) return -1;
            i++;
            if (i < ts.size() && ts.get(i).is(Token.Kind.LT)) {
                i = parseArg(i + 1);
                while (i >= 0 && i < ts.size() && ts.get(i).is(Token.Kind.COMMA)) i = parseArg(i + 1);
                if (i < 0 || i >= ts.size() || !ts.get(i).is(Token.Kind.GT)) return -1;
                i++;
            }
            while (arrays && i < ts.size() && ts.get(i).is(Token.Kind.LBRACKET)) {
                if (i + 1 >= ts.size() || !ts.get(i + 1).is(Token.Kind.RBRACKET)) return -1;
                i += 2;
            }
            return i;
        }

        private int parseArg(int i) {
            if (i < 0 || i >= ts.size()) return -1;
            if (ts.get(i).is(Token.Kind.QUESTION)) {
                i++;
                if (i < ts.size() && (ts.get(i).isWord("extends") || ts.get(i).isWord("super"))) {
                    return new TypeGrammar(ts, true).parseType(i + 1);
                }
                return i;
            }
            return new TypeGrammar(ts, true).parseType(i);
        }
    }
}
