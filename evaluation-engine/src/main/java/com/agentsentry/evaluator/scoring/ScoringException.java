package com.agentsentry.evaluator.scoring;

import com.agentsentry.evaluator.ErrorKind;
import com.agentsentry.evaluator.EvaluationException;

/**
 * Raised when a target profile cannot be scored. Fatal to the run.
 *
 * @author Naveed Gung
 */
public class ScoringException extends EvaluationException {

    public ScoringException(String message) {
        super(ErrorKind.SCORING, message);
    }

    public ScoringException(String message, Throwable cause) {
        super(ErrorKind.SCORING, message, cause);
    }
}
