package com.agentsentry.evaluator;

/**
 * Error taxonomy of an evaluation run.
 *
 * <p>
 * Only {@link #SCORING} is fatal to a run. Every other kind is attempt-scoped:
 * it is logged, tallied in the run summary and the run continues.
 * </p>
 *
 * @author Naveed Gung
 */
public enum ErrorKind {

    SCORING("Malformed or incomplete target profile", true),
    GENERATION("No template could produce a payload", false),
    TARGET_UNREACHABLE("Target did not answer after all retries", false),
    CLASSIFICATION_AMBIGUOUS("Response matched neither blocked nor executed pattern", false),
    ALLOCATION("No arm eligible, fell back to uniform choice", false);

    private final String description;
    private final boolean fatal;

    ErrorKind(String description, boolean fatal) {
        this.description = description;
        this.fatal = fatal;
    }

    public String getDescription() {
        return description;
    }

    public boolean isFatal() {
        return fatal;
    }
}
