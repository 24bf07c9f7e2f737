package com.agentsentry.evaluator.knowledge;

/**
 * Kinds of findings shared through the knowledge base.
 *
 * @author Naveed Gung
 */
public enum InsightType {
    /** A technique worth more budget in later rounds. */
    TECHNIQUE_RECOMMENDATION,
    /** Unusual target behaviour: unreachable, slow or server errors. */
    ANOMALY,
    /** Result of comparing a malicious attempt with its benign variant. */
    COUNTERFACTUAL
}
