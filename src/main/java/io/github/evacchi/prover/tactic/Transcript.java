package io.github.evacchi.prover.tactic;

@FunctionalInterface
public interface Transcript {

    void record(String line);

    Transcript NONE = line -> {};
}
