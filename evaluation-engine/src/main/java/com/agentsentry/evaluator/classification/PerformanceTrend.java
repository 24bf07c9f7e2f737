package com.agentsentry.evaluator.classification;

/**
 * Direction of the target's detection F1 between two consecutive rounds.
 *
 * @author Naveed Gung
 */
public enum PerformanceTrend {
    STABLE,
    IMPROVING,
    DECLINING
}
