package io.github.evacchi.prover.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits surface text into tokens. Keywords are not recognized here: they come
 * out as {@link Token.Kind#IDENT} and the parser decides, since {@code T} is only
 * special inside a type.
 */
final class Lexer {

    record Token(Kind kind, String text, int column) {
        enum Kind { IDENT, IMPLIES, AND, OR, FALSITY, LPAREN, RPAREN, COMMA, COLON, ARROW, BAR, EOF }

        boolean is(Kind k) { return kind == k; }
        boolean isWord(String w) { return kind == Kind.IDENT && text.equals(w); }
    }

    private final String input;
    private int pos = 0;

    private Lexer(String input) {
        this.input = input;
    }

    static List<Token> tokenize(String input) {
        return new Lexer(input).run();
    }

    private List<Token> run() {
        var tokens = new ArrayList<Token>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                tokens.add(new Token(Token.Kind.EOF, "", pos + 1));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) pos++;
    }

    private Token next() {
        int start = pos;
        char c = input.charAt(pos);
        if (Character.isLetter(c)) {
            while (pos < input.length() && isIdentifierPart(input.charAt(pos))) pos++;
            return new Token(Token.Kind.IDENT, input.substring(start, pos), start + 1);
        }
        if (input.startsWith("=>", pos)) return symbol(Token.Kind.IMPLIES, 2);
        if (input.startsWith("/\\", pos)) return symbol(Token.Kind.AND, 2);
        if (input.startsWith("\\/", pos)) return symbol(Token.Kind.OR, 2);
        if (input.startsWith("->", pos)) return symbol(Token.Kind.ARROW, 2);
        switch (c) {
            case '_': return symbol(Token.Kind.FALSITY, 1);
            case '(': return symbol(Token.Kind.LPAREN, 1);
            case ')': return symbol(Token.Kind.RPAREN, 1);
            case ',': return symbol(Token.Kind.COMMA, 1);
            case ':': return symbol(Token.Kind.COLON, 1);
            case '|': return symbol(Token.Kind.BAR, 1);
            default: throw new SyntaxError("Unexpected character '" + c + "'", start + 1);
        }
    }

    private Token symbol(Token.Kind kind, int length) {
        var t = new Token(kind, input.substring(pos, pos + length), pos + 1);
        pos += length;
        return t;
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '\'';
    }
}
