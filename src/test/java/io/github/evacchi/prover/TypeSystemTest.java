package io.github.evacchi.prover;

import org.junit.Test;

import static io.github.evacchi.prover.ProverException.Kind.*;
import static io.github.evacchi.prover.Term.*;
import static io.github.evacchi.prover.Type.*;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

public class TypeSystemTest {

    static final Type A = Atom("A"), B = Atom("B"), C = Atom("C");

    @Test
    public void composition() {
        var compose = Abs("f", Implies(A, B),
                Abs("g", Implies(B, C),
                        Abs("x", A, App(Var("g"), App(Var("f"), Var("x"))))));
        assertEquals(Implies(Implies(A, B), Implies(Implies(B, C), Implies(A, C))),
                TypeSystem.infer(Context.EMPTY, compose));
    }

    @Test
    public void applicationYieldsTheConsequent() {
        var env = Context.EMPTY.extend("f", Implies(A, B)).extend("a", A);
        assertEquals(B, TypeSystem.infer(env, App(Var("f"), Var("a"))));
    }

    @Test
    public void unboundVariable() {
        var e = assertThrows(TypeError.class,
                () -> TypeSystem.infer(Context.EMPTY, Abs("f", A, Var("x"))));
        assertEquals(UNBOUND_VARIABLE, e.kind());
    }

    @Test
    public void applyingANonFunction() {
        var e = assertThrows(TypeError.class,
                () -> TypeSystem.infer(Context.EMPTY, Abs("f", A, Abs("x", B, App(Var("f"), Var("x"))))));
        assertEquals(SHAPE_MISMATCH, e.kind());
    }

    @Test
    public void argumentOfTheWrongType() {
        var e = assertThrows(TypeError.class,
                () -> TypeSystem.infer(Context.EMPTY, Abs("f", Implies(A, B), Abs("x", B, App(Var("f"), Var("x"))))));
        assertEquals(TYPE_MISMATCH, e.kind());
    }

    @Test
    public void conjunctionCommutes() {
        var swap = Abs("t", And(A, B), Pair(Snd(Var("t")), Fst(Var("t"))));
        assertEquals(Implies(And(A, B), And(B, A)), TypeSystem.infer(Context.EMPTY, swap));
    }

    @Test
    public void projectionOfANonPair() {
        var env = Context.EMPTY.extend("t", A);
        assertEquals(SHAPE_MISMATCH, assertThrows(TypeError.class, () -> TypeSystem.infer(env, Fst(Var("t")))).kind());
        assertEquals(SHAPE_MISMATCH, assertThrows(TypeError.class, () -> TypeSystem.infer(env, Snd(Var("t")))).kind());
    }

    @Test
    public void disjunctionCommutes() {
        var swap = Abs("t", Or(A, B),
                Case(Var("t"), "x", Right(B, Var("x")), "y", Left(Var("y"), A)));
        assertEquals(Implies(Or(A, B), Or(B, A)), TypeSystem.infer(Context.EMPTY, swap));
    }

    @Test
    public void caseOnANonDisjunction() {
        var env = Context.EMPTY.extend("t", And(A, B));
        var e = assertThrows(TypeError.class,
                () -> TypeSystem.infer(env, Case(Var("t"), "x", Var("x"), "y", Var("y"))));
        assertEquals(SHAPE_MISMATCH, e.kind());
    }

    @Test
    public void caseBranchesMustBeStructurallyEqual() {
        // B /\ C and C /\ B are equivalent but not equal
        var env = Context.EMPTY.extend("t", Or(A, A)).extend("p", And(B, C));
        var term = Case(Var("t"),
                "x", Abs("z", A, Var("p")),
                "y", Abs("z", A, Pair(Snd(Var("p")), Fst(Var("p")))));
        var e = assertThrows(TypeError.class, () -> TypeSystem.infer(env, term));
        assertEquals(TYPE_MISMATCH, e.kind());
    }

    @Test
    public void caseBranchesSeeTheirOwnBinding() {
        var env = Context.EMPTY.extend("t", Or(A, B));
        var term = Case(Var("t"), "x", Left(Var("x"), B), "x", Right(A, Var("x")));
        assertEquals(Or(A, B), TypeSystem.infer(env, term));
    }

    @Test
    public void truth() {
        var term = Abs("f", Implies(TRUTH, A), App(Var("f"), UNIT));
        assertEquals(Implies(Implies(TRUTH, A), A), TypeSystem.infer(Context.EMPTY, term));
    }

    @Test
    public void exFalso() {
        var term = Abs("t", And(A, Not(A)), Absurd(App(Snd(Var("t")), Fst(Var("t"))), B));
        assertEquals(Implies(And(A, Not(A)), B), TypeSystem.infer(Context.EMPTY, term));
    }

    @Test
    public void absurdNeedsFalsity() {
        var env = Context.EMPTY.extend("a", A);
        var e = assertThrows(TypeError.class, () -> TypeSystem.infer(env, Absurd(Var("a"), B)));
        assertEquals(SHAPE_MISMATCH, e.kind());
    }

    @Test
    public void shadowingPicksTheMostRecentBinding() {
        var env = Context.EMPTY.extend("x", A).extend("x", B);
        assertEquals(B, TypeSystem.infer(env, Var("x")));
        assertEquals(Implies(C, C), TypeSystem.infer(env, Abs("x", C, Var("x"))));
    }

    @Test
    public void inferenceIsDeterministic() {
        var term = Abs("t", Or(A, B), Case(Var("t"), "x", Right(B, Var("x")), "y", Left(Var("y"), A)));
        assertEquals(TypeSystem.infer(Context.EMPTY, term), TypeSystem.infer(Context.EMPTY, term));
    }

    @Test
    public void check() {
        var env = Context.EMPTY.extend("a", A);
        TypeSystem.check(env, Var("a"), A);
        var e = assertThrows(TypeError.class, () -> TypeSystem.check(env, Var("a"), B));
        assertEquals(TYPE_MISMATCH, e.kind());
    }
}
