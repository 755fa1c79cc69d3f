package io.github.evacchi.prover;

import io.github.evacchi.prover.syntax.Printer;

/**
 * Propositions of intuitionistic propositional logic, read as types.
 * <p>
 * Equality is structural: two propositions are equal iff they have the same shape
 * and the same atom names. Nothing is normalized, so {@code A /\ B} and {@code B /\ A}
 * are different types.
 */
public sealed interface Type {

    record Atom(String name) implements Type {
        @Override public String toString() { return Printer.print(this); }
    }
    static Atom Atom(String name) { return new Atom(name); }

    record Implies(Type antecedent, Type consequent) implements Type {
        @Override public String toString() { return Printer.print(this); }
    }
    static Implies Implies(Type antecedent, Type consequent) { return new Implies(antecedent, consequent); }

    record And(Type left, Type right) implements Type {
        @Override public String toString() { return Printer.print(this); }
    }
    static And And(Type left, Type right) { return new And(left, right); }

    record Or(Type left, Type right) implements Type {
        @Override public String toString() { return Printer.print(this); }
    }
    static Or Or(Type left, Type right) { return new Or(left, right); }

    record Truth() implements Type {
        @Override public String toString() { return Printer.print(this); }
    }

    record Falsity() implements Type {
        @Override public String toString() { return Printer.print(this); }
    }

    Truth TRUTH = new Truth();
    Falsity FALSITY = new Falsity();

    // not A is sugar for A => _
    static Implies Not(Type t) { return Implies(t, FALSITY); }

}
