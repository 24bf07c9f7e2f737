package com.agentsentry.evaluator.generation;

import com.agentsentry.evaluator.catalog.TechniqueProfile;

import java.util.Optional;

/**
 * Optional text-generation backend used to draft payloads for techniques that
 * have no specific template.
 *
 * <p>
 * Implementations never throw: any failure yields an empty result and the
 * caller falls back to the generic template bank.
 * </p>
 *
 * @author Naveed Gung
 */
public interface TextGenerationClient {

    /**
     * Draft one command instantiating the technique against the target.
     *
     * @param technique  the technique to instantiate
     * @param targetName name of the target agent
     * @return the drafted command, or empty when none could be produced
     */
    Optional<String> draft(TechniqueProfile technique, String targetName);

    /** Backend used when generation is disabled. */
    static TextGenerationClient disabled() {
        return (technique, targetName) -> Optional.empty();
    }
}
