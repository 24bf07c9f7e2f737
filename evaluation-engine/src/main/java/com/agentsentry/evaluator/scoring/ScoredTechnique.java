package com.agentsentry.evaluator.scoring;

import com.agentsentry.evaluator.catalog.TechniqueProfile;

/**
 * A technique ranked against one target profile.
 *
 * @param technique the catalogued technique
 * @param score     weighted relevance score
 * @param rank      1-based rank in the run's ordering
 *
 * @author Naveed Gung
 */
public record ScoredTechnique(TechniqueProfile technique, double score, int rank) {

    public String id() {
        return technique.id();
    }

    public String category() {
        return technique.category();
    }
}
