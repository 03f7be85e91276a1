package com.hindsight.setforget.service;

import com.google.ortools.linearsolver.MPSolver;

/**
 * Lets a caller interrupt a running squad solve from another thread.
 */
public class SolveHandle {

    private MPSolver solver;
    private boolean cancelled;

    public synchronized void cancel() {
        cancelled = true;
        if (solver != null) {
            solver.interruptSolve();
        }
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    synchronized boolean attach(MPSolver solver) {
        if (cancelled) return false;
        this.solver = solver;
        return true;
    }

    synchronized void detach() {
        this.solver = null;
    }
}
