package com.agentsentry.evaluator.bandit;

/**
 * Selectable allocation policies.
 *
 * @author Naveed Gung
 */
public enum PolicyType {
    THOMPSON,
    UNIFORM
}
