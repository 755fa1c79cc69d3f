package io.github.evacchi.prover.tactic;

import io.github.evacchi.prover.Sequent;

public interface Display {

    void show(Sequent sequent);

    void error(String message);
}
