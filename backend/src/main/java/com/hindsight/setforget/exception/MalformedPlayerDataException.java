package com.hindsight.setforget.exception;

/**
 * Player data is missing a required field or carries a value outside its domain.
 */
public class MalformedPlayerDataException extends RuntimeException {
    public MalformedPlayerDataException(String message) {
        super(message);
    }

    public MalformedPlayerDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
