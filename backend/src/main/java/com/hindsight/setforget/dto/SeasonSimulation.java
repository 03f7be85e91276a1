package com.hindsight.setforget.dto;

import java.util.List;

public record SeasonSimulation(List<GameweekResult> gameweeks, int totalPoints) {

    public SeasonSimulation {
        gameweeks = List.copyOf(gameweeks);
    }

    public static SeasonSimulation of(List<GameweekResult> gameweeks) {
        return new SeasonSimulation(gameweeks, gameweeks.stream().mapToInt(GameweekResult::points).sum());
    }
}
