package io.github.evacchi.prover;

/**
 * Base class of every error the prover raises on purpose. The {@link Kind}
 * tells callers what went wrong without parsing the message.
 */
public class ProverException extends RuntimeException {

    public enum Kind {
        UNBOUND_VARIABLE,
        SHAPE_MISMATCH,
        TYPE_MISMATCH,
        UNKNOWN_COMMAND,
        SYNTAX_ERROR,
        END_OF_INPUT,
        INTERNAL
    }

    private final Kind kind;

    public ProverException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProverException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() { return kind; }
}
