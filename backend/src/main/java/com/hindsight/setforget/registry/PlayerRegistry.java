package com.hindsight.setforget.registry;

/**
 * Source of season player data.
 */
public interface PlayerRegistry {

    /** Highest gameweek whose results are final. */
    int lastCompletedGameweek();

    /**
     * Loads every player with points and minutes for each gameweek of the range, after clamping it to
     * {@code [1, lastCompletedGameweek()]}.
     */
    SeasonSnapshot snapshot(int fromGameweek, int toGameweek);
}
