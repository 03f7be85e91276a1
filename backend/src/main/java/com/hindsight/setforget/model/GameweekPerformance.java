package com.hindsight.setforget.model;

/**
 * Points and minutes a player recorded in one gameweek. Points may be negative.
 */
public record GameweekPerformance(int points, int minutes) {

    public static final GameweekPerformance DID_NOT_PLAY = new GameweekPerformance(0, 0);

    public GameweekPerformance {
        if (minutes < 0) throw new IllegalArgumentException("minutes must be >= 0, was " + minutes);
    }

    public boolean featured() {
        return minutes > 0;
    }
}
