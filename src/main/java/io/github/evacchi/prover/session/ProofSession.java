package io.github.evacchi.prover.session;

import java.io.PrintStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.evacchi.prover.Context;
import io.github.evacchi.prover.ProverException;
import io.github.evacchi.prover.Term;
import io.github.evacchi.prover.Type;
import io.github.evacchi.prover.TypeError;
import io.github.evacchi.prover.TypeSystem;
import io.github.evacchi.prover.syntax.Parser;
import io.github.evacchi.prover.tactic.CommandSource;
import io.github.evacchi.prover.tactic.TacticEngine;
import io.github.evacchi.prover.tactic.Transcript;

import static io.github.evacchi.prover.ProverException.Kind.END_OF_INPUT;
import static io.github.evacchi.prover.ProverException.Kind.INTERNAL;

/**
 * One proof from start to finish: read the goal, run the tactics, print the
 * proof term and type check it once more against the goal.
 * <p>
 * The first line of the command source is the goal. A session started with
 * {@link #create} records that line in the transcript, so the transcript can
 * later be fed back to {@link #replay}.
 */
public class ProofSession {

    private static final Logger logger = LoggerFactory.getLogger(ProofSession.class);

    private final CommandSource commands;
    private final Transcript transcript;
    private final PrintStream out;
    private final boolean fresh;

    private ProofSession(CommandSource commands, Transcript transcript, PrintStream out, boolean fresh) {
        this.commands = commands;
        this.transcript = transcript;
        this.out = out;
        this.fresh = fresh;
    }

    public static ProofSession create(CommandSource commands, Transcript transcript, PrintStream out) {
        return new ProofSession(commands, transcript, out, true);
    }

    public static ProofSession replay(CommandSource commands, PrintStream out) {
        return new ProofSession(commands, Transcript.NONE, out, false);
    }

    public Term run() {
        out.println(fresh ? "Please enter the formula to prove:" : "Goal:");
        var line = commands.nextLine()
                .orElseThrow(() -> new ProverException(END_OF_INPUT, "No goal to prove"));
        if (fresh) transcript.record(line);
        out.println(line);
        Type goal = Parser.parseType(line);
        logger.info("proving {}", goal);

        out.println("Let's prove it.");
        var engine = new TacticEngine(new ConsoleDisplay(out, fresh));
        Term proof = engine.elaborate(Context.EMPTY, goal, commands, transcript);
        out.println("done.");
        out.println("Proof term is");
        out.println(proof);
        out.print("Typechecking... ");
        out.flush();
        try {
            TypeSystem.check(Context.EMPTY, proof, goal);
        } catch (TypeError e) {
            throw new ProverException(INTERNAL, "Proof term " + proof + " does not prove " + goal + ": " + e.getMessage(), e);
        }
        out.println("ok.");
        logger.info("proved {} with {}", goal, proof);
        return proof;
    }
}
