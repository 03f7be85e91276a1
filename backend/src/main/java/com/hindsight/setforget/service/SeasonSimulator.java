package com.hindsight.setforget.service;

import com.hindsight.setforget.dto.GameweekResult;
import com.hindsight.setforget.dto.SeasonSimulation;
import com.hindsight.setforget.model.Squad;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores a squad gameweek by gameweek. Gameweeks are independent: only the squad itself carries over.
 */
public class SeasonSimulator {

    private final GameweekScorer scorer;

    public SeasonSimulator(GameweekScorer scorer) {
        this.scorer = scorer;
    }

    public SeasonSimulator(int lastCompletedGameweek) {
        this(new GameweekScorer(lastCompletedGameweek));
    }

    /** Gameweeks 1 to the last completed one. */
    public SeasonSimulation simulate(Squad squad) {
        return simulate(squad, 1, scorer.getLastCompletedGameweek());
    }

    public SeasonSimulation simulate(Squad squad, int fromGameweek, int toGameweek) {
        List<GameweekResult> results = new ArrayList<>(Math.max(0, toGameweek - fromGameweek + 1));
        for (int gw = fromGameweek; gw <= toGameweek; gw++) {
            results.add(scorer.score(squad, gw));
        }
        return SeasonSimulation.of(results);
    }
}
