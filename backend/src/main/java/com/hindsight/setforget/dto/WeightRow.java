package com.hindsight.setforget.dto;

import java.util.List;

/** One line of the per-weight table. */
public record WeightRow(double weight, boolean success, int bestTotalPoints, List<Long> benchOrder, String error) {

    public static WeightRow of(WeightEvaluation e) {
        return new WeightRow(e.weight(), e.isSuccess(), e.bestTotalPoints(),
                e.isSuccess() ? e.squad().benchOrder() : List.of(), e.error());
    }
}
