package com.ethnicthv.dyneq.processor.decl;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits declaration text into {@link Token}s. {@code >>} is two {@code >} tokens.
 */
public final class DeclarationLexer {
    private DeclarationLexer() {}

    public static List<Token> tokenize(String text) {
        List<Token> out = new ArrayList<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            Token.Kind single = switch (c) {
                case '<' -> Token.Kind.LT;
                case '>' -> Token.Kind.GT;
                case ',' -> Token.Kind.COMMA;
                case '&' -> Token.Kind.AMP;
                case '?' -> Token.Kind.QUESTION;
                case '[' -> Token.Kind.LBRACKET;
                case ']' -> Token.Kind.RBRACKET;
                default -> null;
            };
            if (single != null) {
                out.add(new Token(single, String.valueOf(c), i));
                i++;
                continue;
            }
            if (!Character.isJavaIdentifierStart(c)) {
                throw new ExpansionException("unexpected character '" + c + "' at position " + i + " in \"" + text + "\"");
            }
            int start = i;
            while (i < n && (Character.isJavaIdentifierPart(text.charAt(i)) || text.charAt(i) == '.')) i++;
            String name = text.substring(start, i);
            if (name.endsWith(".") || name.contains("..")) {
                throw new ExpansionException("malformed name '" + name + "' at position " + start);
            }
            for (String segment : name.split("\\.")) {
                if (!Character.isJavaIdentifierStart(segment.charAt(0))) {
                    throw new ExpansionException("malformed name '" + name + "' at position " + start);
                }
            }
            out.add(new Token(Token.Kind.IDENT, name, start));
        }
        return out;
    }
}
