package io.github.evacchi.prover.syntax;

import io.github.evacchi.prover.ProverException;

/** Malformed surface syntax. {@link #column()} is 1-based. */
public class SyntaxError extends ProverException {
    private final int column;

    public SyntaxError(String message, int column) {
        super(Kind.SYNTAX_ERROR, message + " at column " + column);
        this.column = column;
    }

    public int column() { return column; }
}
