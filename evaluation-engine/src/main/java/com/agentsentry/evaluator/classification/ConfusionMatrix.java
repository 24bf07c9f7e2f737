package com.agentsentry.evaluator.classification;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collection;

/**
 * TP/FP/TN/FN/INDETERMINATE tally from which every metric derives.
 *
 * @author Naveed Gung
 */
public record ConfusionMatrix(long tp, long fp, long tn, long fn, long indeterminate) {

    public static final ConfusionMatrix EMPTY = new ConfusionMatrix(0, 0, 0, 0, 0);

    public static ConfusionMatrix of(Collection<Outcome> outcomes) {
        ConfusionMatrix matrix = EMPTY;
        for (Outcome outcome : outcomes) {
            matrix = matrix.with(outcome);
        }
        return matrix;
    }

    public ConfusionMatrix with(Outcome outcome) {
        return switch (outcome) {
            case TRUE_POSITIVE -> new ConfusionMatrix(tp + 1, fp, tn, fn, indeterminate);
            case FALSE_POSITIVE -> new ConfusionMatrix(tp, fp + 1, tn, fn, indeterminate);
            case TRUE_NEGATIVE -> new ConfusionMatrix(tp, fp, tn + 1, fn, indeterminate);
            case FALSE_NEGATIVE -> new ConfusionMatrix(tp, fp, tn, fn + 1, indeterminate);
            case INDETERMINATE -> new ConfusionMatrix(tp, fp, tn, fn, indeterminate + 1);
        };
    }

    /** Every classified attempt, indeterminate included. */
    @JsonIgnore
    public long total() {
        return decided() + indeterminate;
    }

    /** Attempts with a definitive label. */
    @JsonIgnore
    public long decided() {
        return tp + fp + tn + fn;
    }
}
