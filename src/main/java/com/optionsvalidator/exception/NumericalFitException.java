package com.optionsvalidator.exception;

/**
 * A model estimation (GARCH maximum likelihood) did not converge or produced
 * non-finite parameters. Callers downgrade to a simpler estimator.
 */
public class NumericalFitException extends BaseException {

    public NumericalFitException(String message) {
        super(ErrorCode.NUMERICAL_FIT_FAILURE, message);
    }

    public NumericalFitException(String message, Throwable cause) {
        super(ErrorCode.NUMERICAL_FIT_FAILURE, message, cause);
    }
}
