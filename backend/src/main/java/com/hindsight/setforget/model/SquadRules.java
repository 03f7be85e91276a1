package com.hindsight.setforget.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Budget and club limits a squad must respect on top of its structural invariants.
 */
public final class SquadRules {

    public static final int DEFAULT_BUDGET = 1000;
    public static final int MAX_PER_CLUB = 3;

    private SquadRules() {}

    /** Returns the rule violations, empty when the squad complies. */
    public static List<String> violations(Squad squad, int budget) {
        List<String> out = new ArrayList<>();
        int cost = squad.totalCost();
        if (cost > budget) out.add("Squad cost " + cost + " exceeds budget " + budget);
        Map<String, Integer> perClub = new HashMap<>();
        for (Player p : squad.members()) perClub.merge(p.getClub(), 1, Integer::sum);
        perClub.forEach((club, n) -> {
            if (n > MAX_PER_CLUB) out.add("Club " + club + " has " + n + " players (max " + MAX_PER_CLUB + ")");
        });
        return out;
    }

    public static boolean complies(Squad squad, int budget) {
        return violations(squad, budget).isEmpty();
    }
}
