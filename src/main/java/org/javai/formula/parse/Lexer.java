package org.javai.formula.parse;

import org.javai.formula.FormulaSyntaxException;

/**
 * Splits formula text into tokens.
 *
 * <p>Names start with a letter or underscore and continue with letters, digits,
 * underscores and dots. Column names that are not valid names can be written between
 * backticks: {@code `weight (kg)` ~ height}.
 */
final class Lexer {

    private static final String OPERATORS = "~+-*&/^";

    private final String source;
    private int pos;

    Lexer(String source) {
        this.source = source;
    }

    Token next() {
        skipWhitespace();
        if (pos >= source.length()) {
            return new Token(Token.Type.EOF, "", pos);
        }
        int start = pos;
        char c = source.charAt(pos);
        if (Character.isDigit(c) || c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1))) {
            return number(start);
        }
        if (Character.isLetter(c) || c == '_') {
            pos++;
            while (pos < source.length() && isNamePart(source.charAt(pos))) {
                pos++;
            }
            return new Token(Token.Type.NAME, source.substring(start, pos), start);
        }
        if (c == '`') {
            int end = source.indexOf('`', pos + 1);
            if (end < 0) {
                throw new FormulaSyntaxException("unterminated quoted name", source, start);
            }
            if (end == pos + 1) {
                throw new FormulaSyntaxException("empty quoted name", source, start);
            }
            pos = end + 1;
            return new Token(Token.Type.NAME, source.substring(start + 1, end), start);
        }
        pos++;
        if (OPERATORS.indexOf(c) >= 0) {
            return new Token(Token.Type.OPERATOR, String.valueOf(c), start);
        }
        switch (c) {
            case '(':
                return new Token(Token.Type.LPAREN, "(", start);
            case ')':
                return new Token(Token.Type.RPAREN, ")", start);
            case ',':
                return new Token(Token.Type.COMMA, ",", start);
            case '$':
                throw new FormulaSyntaxException("interpolation with $ is not supported in formulas", source, start);
            default:
                throw new FormulaSyntaxException("unexpected character '" + c + "'", source, start);
        }
    }

    private Token number(int start) {
        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
            pos++;
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = mark;
            }
        }
        String text = source.substring(start, pos);
        try {
            Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new FormulaSyntaxException("malformed number '" + text + "'", source, start);
        }
        return new Token(Token.Type.NUMBER, text, start);
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }
}
