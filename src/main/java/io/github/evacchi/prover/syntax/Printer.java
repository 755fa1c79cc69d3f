package io.github.evacchi.prover.syntax;

import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

import io.github.evacchi.prover.Context;
import io.github.evacchi.prover.Sequent;
import io.github.evacchi.prover.Term;
import io.github.evacchi.prover.Type;

import static io.github.evacchi.prover.Term.*;
import static io.github.evacchi.prover.Type.*;

/**
 * Prints the AST back in the syntax accepted by {@link Parser}, with only the
 * parentheses the grammar needs. {@code Parser.parseTerm(print(t))} gives back {@code t}.
 */
public interface Printer {

    // binding strength; a child printed below its required level gets parenthesized
    int IMPLIES_LEVEL = 0, OR_LEVEL = 1, AND_LEVEL = 2, TYPE_ATOM_LEVEL = 3;
    int BINDER_LEVEL = 0, APP_LEVEL = 1, TERM_ATOM_LEVEL = 2;

    static String print(Type t) {
        return print(t, IMPLIES_LEVEL);
    }

    static String print(Term t) {
        return print(t, BINDER_LEVEL);
    }

    static String print(Context ctx) {
        return StreamSupport.stream(ctx.spliterator(), false)
                .map(b -> b.name() + " : " + print(b.type()))
                .collect(Collectors.joining(", "));
    }

    static String print(Sequent s) {
        return s.context().isEmpty()
                ? "|- " + print(s.goal())
                : print(s.context()) + " |- " + print(s.goal());
    }

    private static String print(Type t, int level) {
        if (t instanceof Atom a) {
            return a.name();
        } else if (t instanceof Implies i) {
            return wrap(level, IMPLIES_LEVEL, print(i.antecedent(), OR_LEVEL) + " => " + print(i.consequent(), IMPLIES_LEVEL));
        } else if (t instanceof Or o) {
            return wrap(level, OR_LEVEL, print(o.left(), AND_LEVEL) + " \\/ " + print(o.right(), OR_LEVEL));
        } else if (t instanceof And a) {
            return wrap(level, AND_LEVEL, print(a.left(), TYPE_ATOM_LEVEL) + " /\\ " + print(a.right(), AND_LEVEL));
        } else if (t instanceof Truth) {
            return "T";
        } else if (t instanceof Falsity) {
            return "_";
        }
        throw new IllegalArgumentException("Unknown type " + t.getClass());
    }

    private static String print(Term t, int level) {
        if (t instanceof Var v) {
            return v.name();
        } else if (t instanceof Abs a) {
            return wrap(level, BINDER_LEVEL,
                    "fun (" + a.v() + " : " + print(a.domain()) + ") -> " + print(a.body(), BINDER_LEVEL));
        } else if (t instanceof Case c) {
            // the left branch must not swallow the '|'
            return wrap(level, BINDER_LEVEL,
                    "case " + print(c.scrutinee(), APP_LEVEL) + " of "
                            + c.leftName() + " -> " + print(c.leftBranch(), APP_LEVEL) + " | "
                            + c.rightName() + " -> " + print(c.rightBranch(), BINDER_LEVEL));
        } else if (t instanceof App a) {
            return wrap(level, APP_LEVEL, print(a.fn(), APP_LEVEL) + " " + print(a.arg(), TERM_ATOM_LEVEL));
        } else if (t instanceof Pair p) {
            return "(" + print(p.left()) + ", " + print(p.right()) + ")";
        } else if (t instanceof Fst f) {
            return "fst(" + print(f.pair()) + ")";
        } else if (t instanceof Snd s) {
            return "snd(" + print(s.pair()) + ")";
        } else if (t instanceof Left l) {
            return "left(" + print(l.term()) + ", " + print(l.right()) + ")";
        } else if (t instanceof Right r) {
            return "right(" + print(r.left()) + ", " + print(r.term()) + ")";
        } else if (t instanceof UnitTerm) {
            return "()";
        } else if (t instanceof Absurd a) {
            return "absurd(" + print(a.term()) + ", " + print(a.target()) + ")";
        }
        throw new IllegalArgumentException("Unknown term " + t.getClass());
    }

    private static String wrap(int level, int own, String s) {
        return level > own ? "(" + s + ")" : s;
    }
}
