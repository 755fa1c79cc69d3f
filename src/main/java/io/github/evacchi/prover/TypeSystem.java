package io.github.evacchi.prover;

import static io.github.evacchi.prover.ProverException.Kind.*;
import static io.github.evacchi.prover.Term.*;
import static io.github.evacchi.prover.Type.*;

/**
 * Syntax-directed type inference for proof terms.
 * <p>
 * Every term constructor has exactly one rule, so there is no search and no
 * unification: either the term has a single type in the given context, or a
 * {@link TypeError} says why not.
 */
public interface TypeSystem {

    static Type infer(Context env, Term node) {
        if (node instanceof Var v) {
            return env.lookup(v.name())
                    .orElseThrow(() -> new TypeError(UNBOUND_VARIABLE, "Unbound variable: " + v.name()));
        } else if (node instanceof Abs abs) {
            var body = infer(env.extend(abs.v(), abs.domain()), abs.body());
            return Implies(abs.domain(), body);
        } else if (node instanceof App app) {
            var funType = infer(env, app.fn());
            if (funType instanceof Implies imp) {
                check(env, app.arg(), imp.antecedent());
                return imp.consequent();
            }
            throw shapeMismatch(app.fn(), funType, "an implication");
        } else if (node instanceof Pair p) {
            return And(infer(env, p.left()), infer(env, p.right()));
        } else if (node instanceof Fst f) {
            var t = infer(env, f.pair());
            if (t instanceof And and) return and.left();
            throw shapeMismatch(f.pair(), t, "a conjunction");
        } else if (node instanceof Snd s) {
            var t = infer(env, s.pair());
            if (t instanceof And and) return and.right();
            throw shapeMismatch(s.pair(), t, "a conjunction");
        } else if (node instanceof Left l) {
            return Or(infer(env, l.term()), l.right());
        } else if (node instanceof Right r) {
            return Or(r.left(), infer(env, r.term()));
        } else if (node instanceof Case c) {
            var scrutinee = infer(env, c.scrutinee());
            if (!(scrutinee instanceof Or or)) {
                throw shapeMismatch(c.scrutinee(), scrutinee, "a disjunction");
            }
            var leftType = infer(env.extend(c.leftName(), or.left()), c.leftBranch());
            var rightType = infer(env.extend(c.rightName(), or.right()), c.rightBranch());
            if (!leftType.equals(rightType)) {
                throw new TypeError(TYPE_MISMATCH,
                        "Branches of " + c + " have different types: " + leftType + " and " + rightType);
            }
            return leftType;
        } else if (node instanceof UnitTerm) {
            return TRUTH;
        } else if (node instanceof Absurd a) {
            var t = infer(env, a.term());
            if (t instanceof Falsity) return a.target();
            throw shapeMismatch(a.term(), t, "falsity");
        }
        throw new IllegalArgumentException("Unknown term " + node);
    }

    static void check(Context env, Term node, Type expected) {
        var actual = infer(env, node);
        if (!actual.equals(expected)) {
            throw new TypeError(TYPE_MISMATCH, node + " has type " + actual + " but " + expected + " was expected");
        }
    }

    private static TypeError shapeMismatch(Term t, Type actual, String expected) {
        return new TypeError(SHAPE_MISMATCH, t + " has type " + actual + " which is not " + expected);
    }

}
