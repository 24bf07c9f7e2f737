package com.agentsentry.evaluator.classification;

import com.agentsentry.evaluator.target.AgentResponse;

/**
 * Maps a target response to a confusion-matrix label.
 *
 * <p>
 * Pluggable so that stricter or learned classifiers can replace the keyword
 * heuristic without touching orchestration.
 * </p>
 *
 * @author Naveed Gung
 */
public interface OutcomeClassifier {

    /**
     * @param expectedMalicious whether the dispatched payload was malicious
     * @param response          the target's response to it
     * @return the label with its rationale and confidence
     */
    Classification classify(boolean expectedMalicious, AgentResponse response);

    /** Short name used in logs and the run summary. */
    String name();
}
