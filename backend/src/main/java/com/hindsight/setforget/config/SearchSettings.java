package com.hindsight.setforget.config;

import com.hindsight.setforget.model.SquadRules;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Search knobs: the bench-weight grid, the default budget and whether candidate reductions run in parallel.
 */
@Component
public class SearchSettings {

    public static final String DEFAULT_WEIGHTS =
            "0.05,0.1,0.15,0.2,0.25,0.3,0.35,0.4,0.45,0.5,0.55,0.6,0.65,0.7,0.75,0.8,0.85,0.9,0.95";

    private final List<Double> benchWeights;
    private final int budget;
    private final boolean parallel;

    @Autowired
    public SearchSettings(@Value("${hindsight.search.bench-weights:" + DEFAULT_WEIGHTS + "}") String benchWeights,
                          @Value("${hindsight.search.budget:" + SquadRules.DEFAULT_BUDGET + "}") int budget,
                          @Value("${hindsight.search.parallel:true}") boolean parallel) {
        this(parseWeights(benchWeights), budget, parallel);
    }

    public SearchSettings(List<Double> benchWeights, int budget, boolean parallel) {
        if (benchWeights.isEmpty()) throw new IllegalArgumentException("At least one bench weight is required");
        for (double w : benchWeights) {
            if (!(w > 0.0 && w <= 1.0)) throw new IllegalArgumentException("Bench weight out of (0, 1]: " + w);
        }
        if (budget <= 0) throw new IllegalArgumentException("Budget must be positive, was " + budget);
        this.benchWeights = List.copyOf(benchWeights);
        this.budget = budget;
        this.parallel = parallel;
    }

    static List<Double> parseWeights(String csv) {
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Double::valueOf)
                .toList();
    }

    public List<Double> getBenchWeights() { return benchWeights; }
    public int getBudget() { return budget; }
    public boolean isParallel() { return parallel; }

    public SearchSettings withBudget(int budget) {
        return new SearchSettings(benchWeights, budget, parallel);
    }
}
