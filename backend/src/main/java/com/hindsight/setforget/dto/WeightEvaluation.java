package com.hindsight.setforget.dto;

import com.hindsight.setforget.model.Squad;

/**
 * Phase 1 outcome for a single bench weight: the solved squad with its best bench order, or the failure that
 * stopped the weight from being evaluated.
 */
public record WeightEvaluation(double weight,
                               Squad squad,
                               int bestTotalPoints,
                               SeasonSimulation season,
                               String error) {

    public static WeightEvaluation succeeded(double weight, Squad squad, SeasonSimulation season) {
        return new WeightEvaluation(weight, squad, season.totalPoints(), season, null);
    }

    public static WeightEvaluation failed(double weight, String error) {
        return new WeightEvaluation(weight, null, 0, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
