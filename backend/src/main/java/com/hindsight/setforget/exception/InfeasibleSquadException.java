package com.hindsight.setforget.exception;

/**
 * No squad satisfies the selection rules for the given player pool and budget.
 */
public class InfeasibleSquadException extends RuntimeException {
    private final double benchWeight;
    private final int budget;

    public InfeasibleSquadException(double benchWeight, int budget, String message) {
        super(message);
        this.benchWeight = benchWeight;
        this.budget = budget;
    }

    public double getBenchWeight() { return benchWeight; }
    public int getBudget() { return budget; }
}
