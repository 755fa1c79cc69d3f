package io.github.evacchi.prover.tactic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.evacchi.prover.Context;
import io.github.evacchi.prover.ProverException;
import io.github.evacchi.prover.Sequent;
import io.github.evacchi.prover.Term;
import io.github.evacchi.prover.Type;
import io.github.evacchi.prover.TypeError;
import io.github.evacchi.prover.TypeSystem;
import io.github.evacchi.prover.syntax.Parser;
import io.github.evacchi.prover.syntax.SyntaxError;

import static io.github.evacchi.prover.ProverException.Kind.*;
import static io.github.evacchi.prover.Term.*;
import static io.github.evacchi.prover.Type.*;

/**
 * Builds a proof term for a goal, one tactic at a time.
 * <p>
 * Each supported tactic either closes the goal ({@code exact}) or opens exactly
 * one subgoal ({@code intro}, {@code elim}) whose proof is wrapped into the proof
 * of the current goal, so the only state is the call stack. A tactic that does
 * not apply is reported on the {@link Display} and the same goal is asked again.
 * <p>
 * Running out of commands with a goal still open is fatal and raises a
 * {@link ProverException} of kind {@code END_OF_INPUT}.
 */
public class TacticEngine {

    private static final Logger logger = LoggerFactory.getLogger(TacticEngine.class);

    private final Display display;

    public TacticEngine(Display display) {
        this.display = display;
    }

    public Term elaborate(Context env, Type goal, CommandSource commands, Transcript transcript) {
        var sequent = new Sequent(env, goal);
        while (true) {
            display.show(sequent);
            var line = commands.nextLine()
                    .orElseThrow(() -> new ProverException(END_OF_INPUT, "Input ended while proving " + sequent));
            transcript.record(line);
            var command = Command.parse(line);
            logger.debug("tactic {} '{}' on {}", command.name(), command.argument(), sequent);
            try {
                return apply(command, env, goal, commands, transcript);
            } catch (TacticError e) {
                logger.debug("tactic {} failed: {}", command.name(), e.getMessage());
                display.error(e.getMessage());
            }
        }
    }

    private Term apply(Command command, Context env, Type goal, CommandSource commands, Transcript transcript) {
        return switch (command.name()) {
            case "intro" -> intro(command, env, goal, commands, transcript);
            case "exact" -> exact(command, env, goal);
            case "elim" -> elim(command, env, goal, commands, transcript);
            case "cut" -> throw new TacticError(UNKNOWN_COMMAND, "cut is not implemented.");
            default -> throw new TacticError(UNKNOWN_COMMAND, "Unknown command: " + command.name());
        };
    }

    private Term intro(Command command, Context env, Type goal, CommandSource commands, Transcript transcript) {
        if (!(goal instanceof Implies imp)) {
            throw new TacticError(SHAPE_MISMATCH, "Don't know how to introduce this.");
        }
        if (!command.hasArgument()) {
            throw new TacticError(SYNTAX_ERROR, "Please provide an argument for intro.");
        }
        var x = command.argument();
        if (!Parser.isName(x)) {
            throw new TacticError(SYNTAX_ERROR, "Not a valid name: " + x);
        }
        var body = elaborate(env.extend(x, imp.antecedent()), imp.consequent(), commands, transcript);
        return Abs(x, imp.antecedent(), body);
    }

    private Term exact(Command command, Context env, Type goal) {
        Term t;
        try {
            t = Parser.parseTerm(command.argument());
        } catch (SyntaxError e) {
            throw new TacticError(SYNTAX_ERROR, "Syntax error: " + e.getMessage(), e);
        }
        try {
            TypeSystem.check(env, t, goal);
        } catch (TypeError e) {
            throw new TacticError(e.kind(), "Not the right type. " + e.getMessage(), e);
        }
        return t;
    }

    private Term elim(Command command, Context env, Type goal, CommandSource commands, Transcript transcript) {
        if (!command.hasArgument()) {
            throw new TacticError(SYNTAX_ERROR, "Please provide an argument for elim.");
        }
        var f = command.argument();
        var type = env.lookup(f)
                .orElseThrow(() -> new TacticError(UNBOUND_VARIABLE, "Unbound variable: " + f));
        if (!(type instanceof Implies imp)) {
            throw new TacticError(SHAPE_MISMATCH, "Argument provided is not a function.");
        }
        if (!imp.consequent().equals(goal)) {
            throw new TacticError(TYPE_MISMATCH, "The specified function return type does not match the goal.");
        }
        var arg = elaborate(env, imp.antecedent(), commands, transcript);
        return App(Var(f), arg);
    }
}
