package com.optionsvalidator.exception;

public class InvalidStateException extends BaseException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
