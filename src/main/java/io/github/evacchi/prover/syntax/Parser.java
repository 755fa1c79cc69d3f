package io.github.evacchi.prover.syntax;

import java.util.List;
import java.util.Set;

import io.github.evacchi.prover.Term;
import io.github.evacchi.prover.Type;
import io.github.evacchi.prover.syntax.Lexer.Token;

import static io.github.evacchi.prover.Term.*;
import static io.github.evacchi.prover.Type.*;

/**
 * Recursive-descent parser for propositions and proof terms.
 *
 * <pre>
 * type  ::= disj [ "=>" type ]
 * disj  ::= conj [ "\/" disj ]
 * conj  ::= unary [ "/\" conj ]
 * unary ::= "not" unary | "T" | "_" | ident | "(" type ")"
 *
 * term  ::= "fun" "(" ident ":" type ")" "->" term
 *         | "case" term "of" ident "->" term "|" ident "->" term
 *         | atom { atom }
 * atom  ::= ident | "()" | "(" term ")" | "(" term "," term ")"
 *         | "fst" "(" term ")" | "snd" "(" term ")"
 *         | "left" "(" term "," type ")" | "right" "(" type "," term ")"
 *         | "absurd" "(" term "," type ")"
 * </pre>
 */
public final class Parser {

    static final Set<String> TERM_KEYWORDS = Set.of("fun", "case", "of", "fst", "snd", "left", "right", "absurd");

    private final List<Token> tokens;
    private int pos = 0;

    private Parser(String text) {
        this.tokens = Lexer.tokenize(text);
    }

    public static Type parseType(String text) {
        var p = new Parser(text);
        var t = p.type();
        p.expect(Token.Kind.EOF, "end of input");
        return t;
    }

    public static Term parseTerm(String text) {
        var p = new Parser(text);
        var t = p.term();
        p.expect(Token.Kind.EOF, "end of input");
        return t;
    }

    /** Whether {@code text} can be used as a bound variable in a term. */
    public static boolean isName(String text) {
        if (text.isEmpty() || !Character.isLetter(text.charAt(0))) return false;
        for (int i = 1; i < text.length(); i++) {
            if (!Lexer.isIdentifierPart(text.charAt(i))) return false;
        }
        return !TERM_KEYWORDS.contains(text);
    }

    // types

    private Type type() {
        var lhs = disjunction();
        if (accept(Token.Kind.IMPLIES)) return Implies(lhs, type());
        return lhs;
    }

    private Type disjunction() {
        var lhs = conjunction();
        if (accept(Token.Kind.OR)) return Or(lhs, disjunction());
        return lhs;
    }

    private Type conjunction() {
        var lhs = unary();
        if (accept(Token.Kind.AND)) return And(lhs, conjunction());
        return lhs;
    }

    private Type unary() {
        var t = peek();
        if (t.isWord("not")) {
            advance();
            return Not(unary());
        } else if (t.isWord("T")) {
            advance();
            return TRUTH;
        } else if (t.is(Token.Kind.IDENT)) {
            advance();
            return Atom(t.text());
        } else if (accept(Token.Kind.FALSITY)) {
            return FALSITY;
        } else if (accept(Token.Kind.LPAREN)) {
            var inner = type();
            expect(Token.Kind.RPAREN, "')'");
            return inner;
        }
        throw unexpected(t, "a proposition");
    }

    // terms

    private Term term() {
        var t = peek();
        if (t.isWord("fun")) {
            advance();
            expect(Token.Kind.LPAREN, "'('");
            var v = name();
            expect(Token.Kind.COLON, "':'");
            var domain = type();
            expect(Token.Kind.RPAREN, "')'");
            expect(Token.Kind.ARROW, "'->'");
            return Abs(v, domain, term());
        } else if (t.isWord("case")) {
            advance();
            var scrutinee = term();
            expectWord("of");
            var x = name();
            expect(Token.Kind.ARROW, "'->'");
            var u = term();
            expect(Token.Kind.BAR, "'|'");
            var y = name();
            expect(Token.Kind.ARROW, "'->'");
            var v = term();
            return Case(scrutinee, x, u, y, v);
        }
        var result = atom();
        while (startsAtom(peek())) {
            result = App(result, atom());
        }
        return result;
    }

    private boolean startsAtom(Token t) {
        if (t.is(Token.Kind.LPAREN)) return true;
        return t.is(Token.Kind.IDENT) && !t.isWord("fun") && !t.isWord("case") && !t.isWord("of");
    }

    private Term atom() {
        var t = peek();
        if (t.is(Token.Kind.LPAREN)) {
            advance();
            if (accept(Token.Kind.RPAREN)) return UNIT;
            var first = term();
            if (accept(Token.Kind.COMMA)) {
                var second = term();
                expect(Token.Kind.RPAREN, "')'");
                return Pair(first, second);
            }
            expect(Token.Kind.RPAREN, "')'");
            return first;
        }
        if (!t.is(Token.Kind.IDENT)) throw unexpected(t, "a term");
        switch (t.text()) {
            case "fst": {
                advance();
                return Fst(parenthesized());
            }
            case "snd": {
                advance();
                return Snd(parenthesized());
            }
            case "left": {
                advance();
                expect(Token.Kind.LPAREN, "'('");
                var inner = term();
                expect(Token.Kind.COMMA, "','");
                var other = type();
                expect(Token.Kind.RPAREN, "')'");
                return Left(inner, other);
            }
            case "right": {
                advance();
                expect(Token.Kind.LPAREN, "'('");
                var other = type();
                expect(Token.Kind.COMMA, "','");
                var inner = term();
                expect(Token.Kind.RPAREN, "')'");
                return Right(other, inner);
            }
            case "absurd": {
                advance();
                expect(Token.Kind.LPAREN, "'('");
                var inner = term();
                expect(Token.Kind.COMMA, "','");
                var target = type();
                expect(Token.Kind.RPAREN, "')'");
                return Absurd(inner, target);
            }
            default:
                return Var(name());
        }
    }

    private Term parenthesized() {
        expect(Token.Kind.LPAREN, "'('");
        var t = term();
        expect(Token.Kind.RPAREN, "')'");
        return t;
    }

    private String name() {
        var t = peek();
        if (!t.is(Token.Kind.IDENT) || TERM_KEYWORDS.contains(t.text())) throw unexpected(t, "a variable name");
        advance();
        return t.text();
    }

    // token plumbing

    private Token peek() { return tokens.get(pos); }

    private void advance() {
        if (pos < tokens.size() - 1) pos++;
    }

    private boolean accept(Token.Kind kind) {
        if (peek().is(kind)) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(Token.Kind kind, String what) {
        if (!accept(kind)) throw unexpected(peek(), what);
    }

    private void expectWord(String word) {
        if (!peek().isWord(word)) throw unexpected(peek(), "'" + word + "'");
        advance();
    }

    private static SyntaxError unexpected(Token t, String expected) {
        var found = t.is(Token.Kind.EOF) ? "end of input" : "'" + t.text() + "'";
        return new SyntaxError("Expected " + expected + " but found " + found, t.column());
    }
}
