package com.optionsvalidator.exception;

import java.util.Map;

/**
 * Shape mismatch between two inputs that must line up element for element, e.g. exit
 * premiums vs. position legs. Never recovered.
 */
public class ArgumentMismatchException extends BaseException {

    public ArgumentMismatchException(String message, int expected, int actual) {
        super(ErrorCode.ARGUMENT_MISMATCH, message, Map.of("expected", expected, "actual", actual));
    }
}
