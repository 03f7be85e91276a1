package com.hindsight.setforget.service;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import com.hindsight.setforget.exception.InfeasibleSquadException;
import com.hindsight.setforget.exception.SquadOptimizationException;
import com.hindsight.setforget.model.Player;
import com.hindsight.setforget.model.Position;
import com.hindsight.setforget.model.Squad;
import com.hindsight.setforget.model.SquadRules;
import com.hindsight.setforget.registry.SeasonSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Picks the squad with the highest weighted season score by solving a binary integer program:
 * <pre>
 *   max  sum(lineup * pts) + captain * pts + w * vice * pts + w * sum(bench * pts)
 * </pre>
 * over four 0/1 variables per player, subject to squad size, formation, budget and club limits.
 */
@Service
public class SquadOptimizerService {
    private static final Logger log = LoggerFactory.getLogger(SquadOptimizerService.class);

    static {
        Loader.loadNativeLibraries();
    }

    private final String solverId;
    private final long timeLimitMs;

    public SquadOptimizerService(@Value("${hindsight.optimizer.solver:SCIP}") String solverId,
                                 @Value("${hindsight.optimizer.time-limit-ms:0}") long timeLimitMs) {
        this.solverId = solverId;
        this.timeLimitMs = timeLimitMs;
    }

    public Squad optimize(SeasonSnapshot snapshot, double benchWeight, int budget) {
        return optimize(snapshot.getPlayers(), snapshot.getFromGameweek(), snapshot.getLastCompletedGameweek(),
                benchWeight, budget, new SolveHandle());
    }

    public Squad optimize(SeasonSnapshot snapshot, double benchWeight, int budget, SolveHandle handle) {
        return optimize(snapshot.getPlayers(), snapshot.getFromGameweek(), snapshot.getLastCompletedGameweek(),
                benchWeight, budget, handle);
    }

    /**
     * Solves for the best squad using each player's points over {@code [fromGameweek, toGameweek]}.
     *
     * @throws InfeasibleSquadException    when no legal squad exists
     * @throws SquadOptimizationException  when the solver is unavailable or stops short of optimality
     * @throws CancellationException       when the handle was cancelled
     */
    public Squad optimize(List<Player> players, int fromGameweek, int toGameweek,
                          double benchWeight, int budget, SolveHandle handle) {
        if (!(benchWeight > 0.0 && benchWeight <= 1.0)) {
            throw new IllegalArgumentException("Bench weight must be in (0, 1], was " + benchWeight);
        }
        MPSolver solver = createSolver();
        try {
            int n = players.size();
            int[] points = new int[n];
            for (int i = 0; i < n; i++) points[i] = players.get(i).totalPoints(fromGameweek, toGameweek);

            // variable i belongs to players.get(i)
            MPVariable[] lineup = new MPVariable[n];
            MPVariable[] bench = new MPVariable[n];
            MPVariable[] captain = new MPVariable[n];
            MPVariable[] vice = new MPVariable[n];
            for (int i = 0; i < n; i++) {
                lineup[i] = solver.makeBoolVar("lineup_" + i);
                bench[i] = solver.makeBoolVar("bench_" + i);
                captain[i] = solver.makeBoolVar("captain_" + i);
                vice[i] = solver.makeBoolVar("vice_" + i);
            }

            MPObjective objective = solver.objective();
            for (int i = 0; i < n; i++) {
                objective.setCoefficient(lineup[i], points[i]);
                objective.setCoefficient(captain[i], points[i]);
                objective.setCoefficient(vice[i], benchWeight * points[i]);
                objective.setCoefficient(bench[i], benchWeight * points[i]);
            }
            objective.setMaximization();

            addSizeConstraints(solver, lineup, bench, captain, vice);
            addFormationConstraints(solver, players, lineup, bench);
            addBudgetAndClubConstraints(solver, players, lineup, bench, budget);
            for (int i = 0; i < n; i++) {
                MPConstraint once = solver.makeConstraint(Double.NEGATIVE_INFINITY, 1, "one_role_" + i);
                once.setCoefficient(lineup[i], 1);
                once.setCoefficient(bench[i], 1);
                MPConstraint captainStarts = solver.makeConstraint(Double.NEGATIVE_INFINITY, 0, "captain_starts_" + i);
                captainStarts.setCoefficient(captain[i], 1);
                captainStarts.setCoefficient(lineup[i], -1);
                MPConstraint viceStarts = solver.makeConstraint(Double.NEGATIVE_INFINITY, 0, "vice_starts_" + i);
                viceStarts.setCoefficient(vice[i], 1);
                viceStarts.setCoefficient(lineup[i], -1);
                MPConstraint distinct = solver.makeConstraint(Double.NEGATIVE_INFINITY, 1, "captain_vice_" + i);
                distinct.setCoefficient(captain[i], 1);
                distinct.setCoefficient(vice[i], 1);
            }

            if (timeLimitMs > 0) solver.setTimeLimit(timeLimitMs);
            if (!handle.attach(solver)) {
                throw new CancellationException("Solve cancelled before start");
            }
            long t0 = System.currentTimeMillis();
            MPSolver.ResultStatus status;
            try {
                status = solver.solve();
            } finally {
                handle.detach();
            }
            long durationMs = System.currentTimeMillis() - t0;
            log.debug("[Optimizer][Solve] weight={} budget={} players={} status={} durationMs={}",
                    benchWeight, budget, n, status, durationMs);

            if (handle.isCancelled()) {
                throw new CancellationException("Solve cancelled for weight " + benchWeight);
            }
            if (status == MPSolver.ResultStatus.INFEASIBLE) {
                throw new InfeasibleSquadException(benchWeight, budget,
                        "No legal squad within budget " + budget + " from " + n + " players");
            }
            if (status != MPSolver.ResultStatus.OPTIMAL) {
                throw new SquadOptimizationException("Solver stopped with status " + status + " for weight " + benchWeight);
            }

            Squad squad = extract(players, lineup, bench, captain, vice);
            List<String> violations = SquadRules.violations(squad, budget);
            if (!violations.isEmpty()) {
                throw new SquadOptimizationException("Solver returned a squad breaking the rules: " + violations);
            }
            log.info("[Optimizer][Solved] weight={} objective={} cost={} squad={}",
                    benchWeight, objective.value(), squad.totalCost(), squad);
            return squad;
        } finally {
            solver.delete();
        }
    }

    private MPSolver createSolver() {
        MPSolver solver = MPSolver.createSolver(solverId);
        if (solver == null && !"CBC".equalsIgnoreCase(solverId)) {
            log.warn("[Optimizer] solver {} unavailable, falling back to CBC", solverId);
            solver = MPSolver.createSolver("CBC");
        }
        if (solver == null) {
            throw new SquadOptimizationException("No MIP solver available (requested " + solverId + ")");
        }
        return solver;
    }

    private static void addSizeConstraints(MPSolver solver, MPVariable[] lineup, MPVariable[] bench,
                                           MPVariable[] captain, MPVariable[] vice) {
        MPConstraint lineupSize = solver.makeConstraint(Squad.LINEUP_SIZE, Squad.LINEUP_SIZE, "lineup_size");
        MPConstraint benchSize = solver.makeConstraint(Squad.OUTFIELD_BENCH_SIZE + 1, Squad.OUTFIELD_BENCH_SIZE + 1, "bench_size");
        MPConstraint oneCaptain = solver.makeConstraint(1, 1, "one_captain");
        MPConstraint oneVice = solver.makeConstraint(1, 1, "one_vice");
        for (int i = 0; i < lineup.length; i++) {
            lineupSize.setCoefficient(lineup[i], 1);
            benchSize.setCoefficient(bench[i], 1);
            oneCaptain.setCoefficient(captain[i], 1);
            oneVice.setCoefficient(vice[i], 1);
        }
    }

    private static void addFormationConstraints(MPSolver solver, List<Player> players,
                                                MPVariable[] lineup, MPVariable[] bench) {
        // {min starters, max starters, squad total}
        Map<Position, int[]> limits = new LinkedHashMap<>();
        limits.put(Position.GK, new int[]{1, 1, 2});
        limits.put(Position.DEF, new int[]{3, 5, 5});
        limits.put(Position.MID, new int[]{2, 5, 5});
        limits.put(Position.FWD, new int[]{1, 3, 3});

        for (Map.Entry<Position, int[]> e : limits.entrySet()) {
            Position pos = e.getKey();
            int[] l = e.getValue();
            MPConstraint starters = solver.makeConstraint(l[0], l[1], "starters_" + pos);
            MPConstraint total = solver.makeConstraint(l[2], l[2], "total_" + pos);
            for (int i = 0; i < players.size(); i++) {
                if (players.get(i).getPosition() != pos) continue;
                starters.setCoefficient(lineup[i], 1);
                total.setCoefficient(lineup[i], 1);
                total.setCoefficient(bench[i], 1);
            }
        }
    }

    private static void addBudgetAndClubConstraints(MPSolver solver, List<Player> players,
                                                    MPVariable[] lineup, MPVariable[] bench, int budget) {
        MPConstraint cost = solver.makeConstraint(Double.NEGATIVE_INFINITY, budget, "budget");
        Map<String, MPConstraint> clubs = new LinkedHashMap<>();
        for (int i = 0; i < players.size(); i++) {
            Player p = players.get(i);
            cost.setCoefficient(lineup[i], p.getCost());
            cost.setCoefficient(bench[i], p.getCost());
            MPConstraint club = clubs.computeIfAbsent(p.getClub(), c ->
                    solver.makeConstraint(Double.NEGATIVE_INFINITY, SquadRules.MAX_PER_CLUB, "club_" + clubs.size()));
            club.setCoefficient(lineup[i], 1);
            club.setCoefficient(bench[i], 1);
        }
    }

    private static Squad extract(List<Player> players, MPVariable[] lineupVars, MPVariable[] benchVars,
                                 MPVariable[] captainVars, MPVariable[] viceVars) {
        List<Player> lineup = new ArrayList<>();
        List<Player> outfieldBench = new ArrayList<>();
        Player benchGoalkeeper = null;
        Long captain = null;
        Long vice = null;
        for (int i = 0; i < players.size(); i++) {
            Player p = players.get(i);
            if (lineupVars[i].solutionValue() > 0.5) lineup.add(p);
            if (benchVars[i].solutionValue() > 0.5) {
                if (p.getPosition() == Position.GK) benchGoalkeeper = p;
                else outfieldBench.add(p);
            }
            if (captainVars[i].solutionValue() > 0.5) captain = p.getId();
            if (viceVars[i].solutionValue() > 0.5) vice = p.getId();
        }
        if (benchGoalkeeper == null || captain == null || vice == null) {
            throw new SquadOptimizationException("Solution is missing a bench goalkeeper or captaincy");
        }
        lineup.sort(Squad.FORMATION_ORDER);
        outfieldBench.sort(Squad.FORMATION_ORDER);
        return new Squad(lineup, benchGoalkeeper, outfieldBench, captain, vice);
    }
}
