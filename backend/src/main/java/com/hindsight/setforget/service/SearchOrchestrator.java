package com.hindsight.setforget.service;

import com.hindsight.setforget.config.SearchSettings;
import com.hindsight.setforget.dto.SearchResult;
import com.hindsight.setforget.dto.SeasonSimulation;
import com.hindsight.setforget.dto.WeightEvaluation;
import com.hindsight.setforget.exception.SearchFailedException;
import com.hindsight.setforget.model.Player;
import com.hindsight.setforget.model.Squad;
import com.hindsight.setforget.registry.SeasonSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Two-phase hindsight search over one season snapshot.
 * <ol>
 *   <li>For every bench weight: solve the squad, then try all orders of the three outfield substitutes.</li>
 *   <li>For the best weight: try every ordered (captain, vice-captain) pair from the starting eleven.</li>
 * </ol>
 * Weights fan out on the executor; the inner candidate loops are best-of reductions that may run on parallel
 * streams. A candidate that throws is logged and skipped without affecting its siblings.
 */
public class SearchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SearchOrchestrator.class);

    public static final int BENCH_ORDERS = 6;
    public static final int CAPTAINCY_PAIRS = Squad.LINEUP_SIZE * (Squad.LINEUP_SIZE - 1);

    private final SeasonSnapshot snapshot;
    private final SquadOptimizerService optimizer;
    private final SearchSettings settings;
    private final Executor executor;
    private final SeasonSimulator simulator;

    public SearchOrchestrator(SeasonSnapshot snapshot, SquadOptimizerService optimizer,
                              SearchSettings settings, Executor executor) {
        this.snapshot = snapshot;
        this.optimizer = optimizer;
        this.settings = settings;
        this.executor = executor;
        this.simulator = new SeasonSimulator(snapshot.getLastCompletedGameweek());
    }

    /** Total number of simulations a full run performs, for progress reporting. */
    public int plannedCandidates() {
        return settings.getBenchWeights().size() * BENCH_ORDERS + CAPTAINCY_PAIRS;
    }

    public SearchResult run(SearchMonitor monitor) {
        List<WeightEvaluation> weights = evaluateWeights(monitor);

        Candidates.Scored<WeightEvaluation> bestWeight = Candidates.best(
                        IntStream.range(0, weights.size())
                                .filter(i -> weights.get(i).isSuccess())
                                .mapToObj(i -> new Candidates.Scored<>(i, weights.get(i).bestTotalPoints(), weights.get(i))))
                .orElseThrow(() -> new SearchFailedException("Every bench weight failed; first error: " + weights.get(0).error()));
        WeightEvaluation phaseOne = bestWeight.value();
        log.info("[Search][Phase1] season={} bestWeight={} total={} benchOrder={}",
                snapshot.getSeasonName(), phaseOne.weight(), phaseOne.bestTotalPoints(), phaseOne.squad().benchOrder());

        Evaluated captaincy = bestCaptaincy(phaseOne.squad(), monitor);
        log.info("[Search][Phase2] season={} captain={} vice={} total={}",
                snapshot.getSeasonName(), captaincy.squad().getCaptainId(), captaincy.squad().getViceCaptainId(),
                captaincy.season().totalPoints());

        return new SearchResult(snapshot.getSeasonName(), snapshot.getLastCompletedGameweek(), phaseOne.weight(),
                captaincy.squad(), phaseOne.bestTotalPoints(), captaincy.season().totalPoints(),
                captaincy.season(), weights);
    }

    /** Phase 1 over the whole weight grid; the returned list follows grid order. */
    public List<WeightEvaluation> evaluateWeights(SearchMonitor monitor) {
        List<Double> grid = settings.getBenchWeights();
        monitor.onPhaseStarted("BENCH_ORDER", grid.size() * BENCH_ORDERS);
        List<CompletableFuture<WeightEvaluation>> futures = new ArrayList<>();
        for (double weight : grid) {
            futures.add(CompletableFuture.supplyAsync(() -> evaluateWeight(weight, monitor), executor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof CancellationException) throw (CancellationException) e.getCause();
            throw e;
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    /** Solves the squad for one weight and keeps its best bench order; failures become a failed evaluation. */
    public WeightEvaluation evaluateWeight(double weight, SearchMonitor monitor) {
        checkCancelled(monitor);
        try {
            SolveHandle handle = new SolveHandle();
            monitor.onSolveStarted(handle);
            Squad solved = optimizer.optimize(snapshot, weight, settings.getBudget(), handle);
            Evaluated best = bestBenchOrder(solved, monitor);
            log.debug("[Search][Weight] weight={} total={} benchOrder={}", weight, best.season().totalPoints(), best.squad().benchOrder());
            return WeightEvaluation.succeeded(weight, best.squad(), best.season());
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[Search][Weight] weight={} failed: {}", weight, e.getMessage());
            monitor.onCandidateFailed("weight " + weight + ": " + e.getMessage());
            return WeightEvaluation.failed(weight, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /** Best of the 3! outfield bench orders; the goalkeeper slot never moves. */
    public Evaluated bestBenchOrder(Squad squad, SearchMonitor monitor) {
        List<List<Player>> orders = Candidates.permutations(squad.getOutfieldBench());
        Stream<Candidates.Scored<Evaluated>> scored = IntStream.range(0, orders.size())
                .mapToObj(i -> tryEvaluate(i, () -> squad.withOutfieldBenchOrder(orders.get(i)), monitor))
                .flatMap(Optional::stream);
        return reduce(scored, "bench order");
    }

    /** Best of the 110 ordered (captain, vice-captain) pairs from the lineup. */
    public Evaluated bestCaptaincy(Squad squad, SearchMonitor monitor) {
        List<Player> lineup = squad.getLineup();
        int size = lineup.size();
        monitor.onPhaseStarted("CAPTAINCY", CAPTAINCY_PAIRS);
        Stream<Candidates.Scored<Evaluated>> scored = IntStream.range(0, size * size)
                .filter(i -> i / size != i % size)
                .mapToObj(i -> tryEvaluate(i, () -> squad.withCaptaincy(lineup.get(i / size).getId(), lineup.get(i % size).getId()), monitor))
                .flatMap(Optional::stream);
        return reduce(scored, "captaincy pair");
    }

    private Evaluated reduce(Stream<Candidates.Scored<Evaluated>> scored, String what) {
        Stream<Candidates.Scored<Evaluated>> stream = settings.isParallel() ? scored.parallel() : scored;
        return Candidates.best(stream)
                .map(Candidates.Scored::value)
                .orElseThrow(() -> new SearchFailedException("No " + what + " could be evaluated"));
    }

    private Optional<Candidates.Scored<Evaluated>> tryEvaluate(int index, Supplier<Squad> candidate, SearchMonitor monitor) {
        checkCancelled(monitor);
        try {
            Squad squad = candidate.get();
            SeasonSimulation season = simulate(squad);
            monitor.onCandidateEvaluated();
            return Optional.of(new Candidates.Scored<>(index, season.totalPoints(), new Evaluated(squad, season)));
        } catch (RuntimeException e) {
            log.warn("[Search][Candidate] index={} skipped: {}", index, e.getMessage());
            monitor.onCandidateFailed("candidate " + index + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    /** Replays the gameweeks the snapshot covers, which need not start at gameweek 1. */
    SeasonSimulation simulate(Squad squad) {
        return simulator.simulate(squad, snapshot.getFromGameweek(), snapshot.getLastCompletedGameweek());
    }

    private static void checkCancelled(SearchMonitor monitor) {
        if (monitor.isCancelled()) throw new CancellationException("Search cancelled");
    }

    /** A squad configuration together with its simulated season. */
    public record Evaluated(Squad squad, SeasonSimulation season) {}
}
