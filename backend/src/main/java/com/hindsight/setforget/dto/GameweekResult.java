package com.hindsight.setforget.dto;

import java.util.List;

/**
 * Outcome of replaying one gameweek for a fixed squad.
 *
 * @param unfilled non-featured starters no bench player could replace, in lineup order
 */
public record GameweekResult(int gameweek,
                             int points,
                             List<Substitution> substitutions,
                             List<Long> unfilled,
                             boolean captainFeatured,
                             boolean viceUsedAsCaptain) {

    public GameweekResult {
        substitutions = List.copyOf(substitutions);
        unfilled = List.copyOf(unfilled);
    }

    /** Result for a gameweek that has not been completed yet. */
    public static GameweekResult notPlayed(int gameweek) {
        return new GameweekResult(gameweek, 0, List.of(), List.of(), false, false);
    }
}
