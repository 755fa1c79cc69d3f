package io.github.evacchi.prover;

import io.github.evacchi.prover.syntax.Printer;

public record Sequent(Context context, Type goal) {
    @Override public String toString() { return Printer.print(this); }
}
