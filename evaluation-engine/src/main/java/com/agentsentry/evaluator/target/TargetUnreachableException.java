package com.agentsentry.evaluator.target;

import com.agentsentry.evaluator.ErrorKind;
import com.agentsentry.evaluator.EvaluationException;

/**
 * Raised when the target did not answer within the timeout after every retry.
 *
 * @author Naveed Gung
 */
public class TargetUnreachableException extends EvaluationException {

    public TargetUnreachableException(String message, Throwable cause) {
        super(ErrorKind.TARGET_UNREACHABLE, message, cause);
    }
}
