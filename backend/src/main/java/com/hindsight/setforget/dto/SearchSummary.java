package com.hindsight.setforget.dto;

import com.hindsight.setforget.model.OptimalSquadMember;
import com.hindsight.setforget.service.OptimalSquadService;

import java.util.List;

/**
 * JSON view of a completed search.
 */
public record SearchSummary(String season,
                            int lastCompletedGameweek,
                            double weight,
                            int phaseOneTotal,
                            int totalPoints,
                            long captainId,
                            long viceCaptainId,
                            List<Long> benchOrder,
                            int squadCost,
                            List<OptimalSquadMember> squad,
                            List<GameweekResult> gameweeks) {

    public static SearchSummary of(String jobId, SearchResult r) {
        return new SearchSummary(r.seasonName(), r.lastCompletedGameweek(), r.weight(), r.phaseOneTotal(),
                r.totalPoints(), r.squad().getCaptainId(), r.squad().getViceCaptainId(), r.squad().benchOrder(),
                r.squad().totalCost(),
                OptimalSquadService.toRows(jobId, r.seasonName(), r.squad()),
                r.simulation().gameweeks());
    }
}
