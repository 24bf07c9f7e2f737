package com.agentsentry.evaluator.bandit;

import com.agentsentry.evaluator.ErrorKind;
import com.agentsentry.evaluator.EvaluationException;

/**
 * Raised by an allocation policy when no arm is eligible.
 *
 * @author Naveed Gung
 */
public class AllocationException extends EvaluationException {

    public AllocationException(String message) {
        super(ErrorKind.ALLOCATION, message);
    }
}
