package com.hindsight.setforget.exception;

/**
 * A search produced no result because every candidate at some stage failed.
 */
public class SearchFailedException extends RuntimeException {
    public SearchFailedException(String message) {
        super(message);
    }
}
