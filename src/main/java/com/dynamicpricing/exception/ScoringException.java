package com.dynamicpricing.exception;

/**
 * Raised by a {@link com.dynamicpricing.scoring.Scorer} when the model could not produce
 * a multiplier: timeout, process failure, or malformed output.
 *
 * <p>Never leaves the tick: the pricing adapter converts it into a fallback result.
 */
public class ScoringException extends BaseException {

    public ScoringException(String message) {
        super(ErrorCode.SCORING_ERROR, message);
    }

    public ScoringException(String message, Throwable cause) {
        super(ErrorCode.SCORING_ERROR, message, cause);
    }
}
