package io.github.evacchi.prover.session;

import java.io.PrintStream;

import io.github.evacchi.prover.Sequent;
import io.github.evacchi.prover.tactic.Display;

public class ConsoleDisplay implements Display {
    private final PrintStream out;
    private final boolean prompt;

    public ConsoleDisplay(PrintStream out, boolean prompt) {
        this.out = out; this.prompt = prompt;
    }

    @Override
    public void show(Sequent sequent) {
        out.println(sequent);
        if (prompt) {
            out.print("? ");
            out.flush();
        }
    }

    @Override
    public void error(String message) {
        out.println(message);
    }
}
