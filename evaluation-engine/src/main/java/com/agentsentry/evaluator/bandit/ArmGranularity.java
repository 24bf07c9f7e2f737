package com.agentsentry.evaluator.bandit;

/**
 * What a bandit arm stands for.
 *
 * @author Naveed Gung
 */
public enum ArmGranularity {
    /** One arm per payload category (tactic). */
    CATEGORY,
    /** One arm per technique id. */
    TECHNIQUE
}
