package com.hindsight.setforget.service;

/**
 * Observer for a running search: progress counters, cancellation and in-flight solves.
 */
public interface SearchMonitor {

    SearchMonitor NONE = new SearchMonitor() {};

    default void onPhaseStarted(String phase, int candidates) {}

    default void onCandidateEvaluated() {}

    default void onCandidateFailed(String reason) {}

    default void onSolveStarted(SolveHandle handle) {}

    default boolean isCancelled() { return false; }
}
