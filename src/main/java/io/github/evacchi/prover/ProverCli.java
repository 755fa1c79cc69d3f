package io.github.evacchi.prover;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.evacchi.prover.session.ProofSession;
import io.github.evacchi.prover.session.WriterTranscript;
import io.github.evacchi.prover.tactic.CommandSource;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Command line entry point.
 * <pre>
 *   prover --create NAME   prove a goal typed on standard input, recording NAME.proof
 *   prover --load NAME     replay NAME.proof
 *   prover                 ask which of the two to do
 * </pre>
 */
@Command(
    name = "prover",
    description = "Interactive prover for intuitionistic propositional logic",
    mixinStandardHelpOptions = true,
    version = "prover 1.0.0"
)
public class ProverCli implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(ProverCli.class);

    static final String EXTENSION = ".proof";

    static class Mode {
        @Option(names = "--load", paramLabel = "NAME", description = "Replay the proof stored in NAME.proof")
        String load;

        @Option(names = "--create", paramLabel = "NAME", description = "Write a new proof to NAME.proof")
        String create;
    }

    @ArgGroup(exclusive = true)
    Mode mode;

    @Option(names = {"-d", "--directory"}, paramLabel = "DIR", defaultValue = ".",
            description = "Directory holding the .proof files (default: ${DEFAULT-VALUE})")
    Path directory;

    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;

    public ProverCli() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out, System.err);
    }

    ProverCli(BufferedReader in, PrintStream out, PrintStream err) {
        this.in = in; this.out = out; this.err = err;
    }

    @Override
    public Integer call() throws IOException {
        if (mode == null && !askMode()) {
            err.println("Please answer y or n.");
            return 2;
        }
        try {
            if (mode.load != null) {
                load(directory.resolve(mode.load + EXTENSION));
            } else {
                create(directory.resolve(mode.create + EXTENSION));
            }
            return 0;
        } catch (ProverException e) {
            logger.error("proof aborted ({}): {}", e.kind(), e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException | UncheckedIOException e) {
            var cause = e instanceof UncheckedIOException u ? u.getCause() : e;
            logger.error("proof aborted: {}", cause.toString(), cause);
            err.println("Error: " + cause);
            return 1;
        }
    }

    private void load(Path file) throws IOException {
        logger.info("replaying {}", file);
        try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            ProofSession.replay(CommandSource.of(reader), out).run();
        }
    }

    private void create(Path file) throws IOException {
        logger.info("recording to {}", file);
        try (var transcript = new WriterTranscript(Files.newBufferedWriter(file, StandardCharsets.UTF_8))) {
            ProofSession.create(CommandSource.of(in), transcript, out).run();
        }
    }

    // the original interactive dialogue, used when neither --load nor --create is given
    private boolean askMode() throws IOException {
        out.println("Would you like to load the proof from a file? [y/n]");
        var answer = in.readLine();
        mode = new Mode();
        if ("y".equals(answer)) {
            out.println("Please specify the name of the file that contains the proof:");
            mode.load = in.readLine();
            return mode.load != null;
        } else if ("n".equals(answer)) {
            out.println("Please specify the name of the file that will store the proof:");
            mode.create = in.readLine();
            return mode.create != null;
        }
        return false;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ProverCli()).execute(args);
        System.exit(exitCode);
    }
}
