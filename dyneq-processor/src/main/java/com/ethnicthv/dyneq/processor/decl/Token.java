package com.ethnicthv.dyneq.processor.decl;

/**
 * One lexical token of a declaration. Qualified names ({@code java.lang.Readable}) and keywords
 * ({@code where}, {@code extends}) are single {@link Kind#IDENT} tokens.
 */
public record Token(Kind kind, String text, int position) {

    public enum Kind { IDENT, LT, GT, COMMA, AMP, QUESTION, LBRACKET, RBRACKET }

    public boolean is(Kind k) {
        return kind == k;
    }

    public boolean isWord(String word) {
        return kind == Kind.IDENT && text.equals(word);
    }

    public boolean isKeyword() {
        return kind == Kind.IDENT && (text.equals("where") || text.equals("extends") || text.equals("super"));
    }
}
