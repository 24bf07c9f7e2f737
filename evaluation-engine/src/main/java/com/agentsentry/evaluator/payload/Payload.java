package com.agentsentry.evaluator.payload;

import java.util.Objects;

/**
 * Concrete command content instantiating a technique.
 *
 * <p>
 * Immutable. A payload is dispatched at most once as an attack attempt.
 * </p>
 *
 * @param id          run-unique identifier ({@code P-n} generated,
 *                    {@code M-n} mutated)
 * @param content     the command text sent to the target
 * @param techniqueId owning technique
 * @param category    category label (first tactic, or
 *                    {@value #CONTROL_CATEGORY})
 * @param malicious   expected-malicious flag
 * @param severity    severity derived from the technique's tactics
 * @param parentId    parent payload id when mutated, otherwise null
 * @param generation  0 for generated payloads, parent generation + 1 for
 *                    mutants
 *
 * @author Naveed Gung
 */
public record Payload(
        String id,
        String content,
        String techniqueId,
        String category,
        boolean malicious,
        Severity severity,
        String parentId,
        int generation) {

    public static final String CONTROL_CATEGORY = "benign-control";

    public Payload {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(category, "category");
        severity = severity == null ? Severity.LOW : severity;
    }

    public boolean isControl() {
        return CONTROL_CATEGORY.equals(category);
    }

    public boolean isMutated() {
        return parentId != null;
    }
}
