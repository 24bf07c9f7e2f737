package com.agentsentry.evaluator.mutation;

/**
 * Payload mutation operators.
 *
 * @author Naveed Gung
 */
public enum MutationOperator {
    /** Token substitution from the synonym/obfuscation bank. */
    SUBSTITUTION,
    /** Delimiter or encoding wrapping. */
    WRAPPING,
    /** Instruction reordering. */
    REORDERING,
    /** Combination with a second archive member. */
    CROSSOVER
}
