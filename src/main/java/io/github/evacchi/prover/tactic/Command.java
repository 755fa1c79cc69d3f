package io.github.evacchi.prover.tactic;

/** A command line split into the tactic name and its trimmed argument. */
record Command(String name, String argument) {

    static Command parse(String line) {
        int n = line.indexOf(' ');
        if (n < 0) return new Command(line, "");
        return new Command(line.substring(0, n), line.substring(n).trim());
    }

    boolean hasArgument() { return !argument.isEmpty(); }
}
