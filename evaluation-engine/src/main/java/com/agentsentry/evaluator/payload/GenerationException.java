package com.agentsentry.evaluator.payload;

import com.agentsentry.evaluator.ErrorKind;
import com.agentsentry.evaluator.EvaluationException;

/**
 * Raised when neither a technique-specific template nor the generic fallback
 * can produce a payload. The technique is skipped.
 *
 * @author Naveed Gung
 */
public class GenerationException extends EvaluationException {

    private final String techniqueId;

    public GenerationException(String techniqueId, String message) {
        super(ErrorKind.GENERATION, message);
        this.techniqueId = techniqueId;
    }

    public String getTechniqueId() {
        return techniqueId;
    }
}
