package com.hindsight.setforget.dto;

import com.hindsight.setforget.model.Squad;

import java.util.List;

/**
 * Final outcome of a hindsight search.
 *
 * @param phaseOneTotal season total of the best weight before the captaincy search
 * @param totalPoints   season total of the final squad, bench order and captaincy pair
 */
public record SearchResult(String seasonName,
                           int lastCompletedGameweek,
                           double weight,
                           Squad squad,
                           int phaseOneTotal,
                           int totalPoints,
                           SeasonSimulation simulation,
                           List<WeightEvaluation> weights) {

    public SearchResult {
        weights = List.copyOf(weights);
    }
}
