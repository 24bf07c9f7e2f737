package com.agentsentry.evaluator.summary;

/**
 * Per-technique attempt statistics of a run.
 *
 * @author Naveed Gung
 */
public record TechniqueUsage(
        String techniqueId,
        String name,
        String category,
        int rank,
        double relevanceScore,
        long attempts,
        long controls,
        long evasions,
        long blocked,
        long indeterminate,
        long mutated) {
}
