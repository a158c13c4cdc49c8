package org.javai.formula.parse;

/**
 * A lexical token of formula text.
 *
 * @param type the token type
 * @param text the token's text; for quoted names, the name without quotes
 * @param position zero-based offset of the token's first character
 */
record Token(Type type, String text, int position) {

    enum Type {
        NUMBER,
        NAME,
        OPERATOR,
        LPAREN,
        RPAREN,
        COMMA,
        EOF
    }

    boolean is(Type type) {
        return this.type == type;
    }

    boolean isOperator(String op) {
        return type == Type.OPERATOR && text.equals(op);
    }

    String describe() {
        return type == Type.EOF ? "end of formula" : "'" + text + "'";
    }
}
