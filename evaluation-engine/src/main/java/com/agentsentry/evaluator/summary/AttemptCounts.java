package com.agentsentry.evaluator.summary;

/**
 * Attempt accounting that keeps missing data from reading as a defensive
 * success.
 *
 * @param completed     attempts with a definitive label
 * @param indeterminate attempts labelled INDETERMINATE
 * @param abandoned     attempts still in flight when the run was sealed
 *
 * @author Naveed Gung
 */
public record AttemptCounts(long completed, long indeterminate, long abandoned) {
}
