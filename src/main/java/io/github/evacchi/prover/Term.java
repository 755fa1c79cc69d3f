package io.github.evacchi.prover;

import io.github.evacchi.prover.syntax.Printer;

public sealed interface Term {

    record Var(String name) implements Term {
        @Override public String toString() { return Printer.print(this); }
    }
    static Var Var(String name) { return new Var(name); }

    record Abs(String v, Type domain, Term body) implements Term {
        @Override public String toString() { return Printer.print(this); }
    }
    static Abs Abs(String v, Type domain, Term body) { return new Abs(v, domain, body); }

    record App(Term fn, Term arg) implements Term {
        @Override public String toString() { return Printer.print(this); }
    }
    static App App(Term fn, Term arg) { return new App(fn, arg); }

    record Pair(Term left, Term right) implements Term {
        @Override public String toString() { return Printer.print(this); }
    }
    static Pair Pair(Term left, Term right) { return new Pair(left, right); }

    record Fst(Term pair) implements Term {
        @Override public String toString() { return Printer.print(this); }
    }
    static Fst Fst(Term pair) { return new Fst(pair); }

    record Snd(Term pair) implements Term {
        @Override public String toString() { return Printer.print(this); }
    }
    static Snd Snd(Term pair) { return new Snd(pair); }

    // the side that is not inhabited has to be spelled out
    record Left(Term term, Type right) implements Term {
        @Override public String toString() { return Printer.print(this); }
    }
    static Left Left(Term term, Type right) { return new Left(term, right); }

    record Right(Type left, Term term) implements Term {
        @Override public String toString() { return Printer.print(this); }
    }
    static Right Right(Type left, Term term) { return new Right(left, term); }

    record Case(Term scrutinee, String leftName, Term leftBranch, String rightName, Term rightBranch) implements Term {
        @Override public String toString() { return Printer.print(this); }
    }
    static Case Case(Term scrutinee, String leftName, Term leftBranch, String rightName, Term rightBranch) {
        return new Case(scrutinee, leftName, leftBranch, rightName, rightBranch);
    }

    record UnitTerm() implements Term {
        @Override public String toString() { return Printer.print(this); }
    }

    record Absurd(Term term, Type target) implements Term {
        @Override public String toString() { return Printer.print(this); }
    }
    static Absurd Absurd(Term term, Type target) { return new Absurd(term, target); }

    UnitTerm UNIT = new UnitTerm();

}
