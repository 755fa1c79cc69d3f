package io.github.evacchi.prover.session;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import org.junit.Test;

import io.github.evacchi.prover.ProverException;
import io.github.evacchi.prover.Term;
import io.github.evacchi.prover.syntax.SyntaxError;
import io.github.evacchi.prover.tactic.CommandSource;
import io.github.evacchi.prover.tactic.Transcript;

import static io.github.evacchi.prover.Term.*;
import static io.github.evacchi.prover.Type.*;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class ProofSessionTest {

    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    final PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);

    private String output() {
        return bytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void createRecordsTheGoalAndEveryCommand() throws Exception {
        var writer = new StringWriter();
        Term proof;
        try (var transcript = new WriterTranscript(writer)) {
            proof = ProofSession.create(
                    CommandSource.of("A => B => A", "intro x", "oops", "intro y", "exact x"), transcript, out).run();
        }
        assertEquals(Abs("x", Atom("A"), Abs("y", Atom("B"), Var("x"))), proof);
        assertEquals("A => B => A\nintro x\noops\nintro y\nexact x\n", writer.toString());
        var output = output();
        assertTrue(output.contains("Please enter the formula to prove:"));
        assertTrue(output.contains("Unknown command: oops"));
        assertTrue(output.contains("? "));
        assertTrue(output.contains("fun (x : A) -> fun (y : B) -> x"));
        assertTrue(output.endsWith("Typechecking... ok." + System.lineSeparator()));
    }

    @Test
    public void replayRebuildsTheSameProof() {
        var transcript = "A /\\ B => B /\\ A\nintro t\nexact (snd(t), fst(t))\n";
        var proof = ProofSession.replay(CommandSource.of(new BufferedReader(new StringReader(transcript))), out).run();
        assertEquals(Abs("t", And(Atom("A"), Atom("B")), Pair(Snd(Var("t")), Fst(Var("t")))), proof);
        var output = output();
        assertTrue(output.startsWith("Goal:"));
        assertFalse(output.contains("? "));
    }

    @Test
    public void malformedGoalIsFatal() {
        assertThrows(SyntaxError.class,
                () -> ProofSession.create(CommandSource.of("A =>", "intro x"), Transcript.NONE, out).run());
    }

    @Test
    public void missingGoalIsFatal() {
        var e = assertThrows(ProverException.class,
                () -> ProofSession.replay(CommandSource.of(), out).run());
        assertEquals(ProverException.Kind.END_OF_INPUT, e.kind());
    }

    @Test
    public void unfinishedProofIsFatal() {
        var e = assertThrows(ProverException.class,
                () -> ProofSession.replay(CommandSource.of("A => A", "intro x"), out).run());
        assertEquals(ProverException.Kind.END_OF_INPUT, e.kind());
    }
}
