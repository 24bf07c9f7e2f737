package com.agentsentry.evaluator;

/**
 * Base type for every error raised by the evaluation engine.
 *
 * @author Naveed Gung
 */
public class EvaluationException extends RuntimeException {

    private final ErrorKind kind;

    public EvaluationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EvaluationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
