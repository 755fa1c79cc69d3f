package io.github.evacchi.prover.tactic;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;

@FunctionalInterface
public interface CommandSource {

    /** The next line without its terminator, or empty once the input is exhausted. */
    Optional<String> nextLine();

    static CommandSource of(BufferedReader reader) {
        return () -> {
            try {
                return Optional.ofNullable(reader.readLine());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        };
    }

    static CommandSource of(List<String> lines) {
        var it = lines.iterator();
        return () -> it.hasNext() ? Optional.of(it.next()) : Optional.empty();
    }

    static CommandSource of(String... lines) {
        return of(List.of(lines));
    }
}
