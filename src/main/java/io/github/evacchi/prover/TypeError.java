package io.github.evacchi.prover;

public class TypeError extends ProverException {
    public TypeError(Kind kind, String message) {
        super(kind, message);
    }
}
