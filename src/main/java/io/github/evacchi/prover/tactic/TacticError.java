package io.github.evacchi.prover.tactic;

import io.github.evacchi.prover.ProverException;

/**
 * A tactic that could not be applied to the current goal. The engine reports it
 * and asks again for the same goal; it never ends a proof.
 */
public class TacticError extends ProverException {
    public TacticError(Kind kind, String message) {
        super(kind, message);
    }

    public TacticError(Kind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
