package com.hindsight.setforget.exception;

/**
 * The solver could not be created or stopped without proving an optimum.
 */
public class SquadOptimizationException extends RuntimeException {
    public SquadOptimizationException(String message) {
        super(message);
    }
}
