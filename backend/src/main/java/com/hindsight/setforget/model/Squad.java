package com.hindsight.setforget.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A fixed 15-player selection: an ordered starting eleven, a bench goalkeeper, three outfield substitutes in
 * priority order, and a captain/vice-captain pair drawn from the eleven.
 * <p>
 * Instances are immutable; the bench order and captaincy can only change by deriving a new squad.
 */
public final class Squad {

    public static final int LINEUP_SIZE = 11;
    public static final int OUTFIELD_BENCH_SIZE = 3;
    public static final int SQUAD_SIZE = 15;

    /** GK, DEF, MID, FWD, then player id. */
    public static final Comparator<Player> FORMATION_ORDER =
            Comparator.comparing(Player::getPosition).thenComparingLong(Player::getId);

    private static final Map<Position, Integer> SQUAD_QUOTA = Map.of(
            Position.GK, 2, Position.DEF, 5, Position.MID, 5, Position.FWD, 3);

    private final List<Player> lineup;
    private final Player benchGoalkeeper;
    private final List<Player> outfieldBench;
    private final long captainId;
    private final long viceCaptainId;

    public Squad(List<Player> lineup, Player benchGoalkeeper, List<Player> outfieldBench,
                 long captainId, long viceCaptainId) {
        this.lineup = List.copyOf(lineup);
        this.benchGoalkeeper = Objects.requireNonNull(benchGoalkeeper, "benchGoalkeeper");
        this.outfieldBench = List.copyOf(outfieldBench);
        this.captainId = captainId;
        this.viceCaptainId = viceCaptainId;
        validate();
    }

    private void validate() {
        if (lineup.size() != LINEUP_SIZE) {
            throw new IllegalArgumentException("Lineup must have " + LINEUP_SIZE + " players, had " + lineup.size());
        }
        if (outfieldBench.size() != OUTFIELD_BENCH_SIZE) {
            throw new IllegalArgumentException("Outfield bench must have " + OUTFIELD_BENCH_SIZE + " players, had " + outfieldBench.size());
        }
        if (benchGoalkeeper.getPosition() != Position.GK) {
            throw new IllegalArgumentException("Bench goalkeeper slot holds a " + benchGoalkeeper.getPosition());
        }
        for (Player p : outfieldBench) {
            if (!p.getPosition().isOutfield()) {
                throw new IllegalArgumentException("Outfield bench slot holds a goalkeeper: " + p);
            }
        }
        Set<Long> ids = new HashSet<>();
        for (Player p : members()) {
            if (!ids.add(p.getId())) throw new IllegalArgumentException("Player appears twice in squad: " + p);
        }

        Map<Position, Integer> starting = countByPosition(lineup);
        Map<Position, Integer> total = countByPosition(members());
        for (Map.Entry<Position, Integer> quota : SQUAD_QUOTA.entrySet()) {
            if (total.get(quota.getKey()) != quota.getValue().intValue()) {
                throw new IllegalArgumentException("Squad needs " + quota.getValue() + " " + quota.getKey() + ", had " + total.get(quota.getKey()));
            }
        }
        if (starting.get(Position.GK) != 1) throw new IllegalArgumentException("Lineup needs exactly one GK");
        int def = starting.get(Position.DEF);
        if (def < 3 || def > 5) throw new IllegalArgumentException("Lineup needs 3-5 DEF, had " + def);
        if (starting.get(Position.MID) < 2) throw new IllegalArgumentException("Lineup needs at least 2 MID");
        if (starting.get(Position.FWD) < 1) throw new IllegalArgumentException("Lineup needs at least 1 FWD");

        if (captainId == viceCaptainId) throw new IllegalArgumentException("Captain and vice-captain must differ");
        if (findInLineup(captainId).isEmpty()) throw new IllegalArgumentException("Captain " + captainId + " is not in the lineup");
        if (findInLineup(viceCaptainId).isEmpty()) throw new IllegalArgumentException("Vice-captain " + viceCaptainId + " is not in the lineup");
    }

    public static Map<Position, Integer> countByPosition(List<Player> players) {
        Map<Position, Integer> counts = new EnumMap<>(Position.class);
        for (Position p : Position.values()) counts.put(p, 0);
        for (Player p : players) counts.merge(p.getPosition(), 1, Integer::sum);
        return counts;
    }

    public List<Player> getLineup() { return lineup; }
    public Player getBenchGoalkeeper() { return benchGoalkeeper; }
    public List<Player> getOutfieldBench() { return outfieldBench; }
    public long getCaptainId() { return captainId; }
    public long getViceCaptainId() { return viceCaptainId; }

    public Player getCaptain() { return findInLineup(captainId).orElseThrow(); }
    public Player getViceCaptain() { return findInLineup(viceCaptainId).orElseThrow(); }

    /** Bench goalkeeper first, then the outfield substitutes in priority order. */
    public List<Player> getBench() {
        List<Player> bench = new ArrayList<>(OUTFIELD_BENCH_SIZE + 1);
        bench.add(benchGoalkeeper);
        bench.addAll(outfieldBench);
        return bench;
    }

    public List<Long> benchOrder() {
        return getBench().stream().map(Player::getId).toList();
    }

    /** Lineup followed by the bench in bench order. */
    public List<Player> members() {
        List<Player> all = new ArrayList<>(SQUAD_SIZE);
        all.addAll(lineup);
        all.addAll(getBench());
        return all;
    }

    public int totalCost() {
        return members().stream().mapToInt(Player::getCost).sum();
    }

    public boolean inLineup(long playerId) {
        return findInLineup(playerId).isPresent();
    }

    public boolean onBench(long playerId) {
        return getBench().stream().anyMatch(p -> p.getId() == playerId);
    }

    private Optional<Player> findInLineup(long playerId) {
        return lineup.stream().filter(p -> p.getId() == playerId).findFirst();
    }

    /** Same squad with the outfield substitutes reordered; the order must be a permutation of the current bench. */
    public Squad withOutfieldBenchOrder(List<Player> order) {
        if (order.size() != OUTFIELD_BENCH_SIZE || !new HashSet<>(order).equals(new HashSet<>(outfieldBench))) {
            throw new IllegalArgumentException("Bench order " + order + " is not a permutation of " + outfieldBench);
        }
        return new Squad(lineup, benchGoalkeeper, order, captainId, viceCaptainId);
    }

    public Squad withCaptaincy(long captain, long viceCaptain) {
        return new Squad(lineup, benchGoalkeeper, outfieldBench, captain, viceCaptain);
    }

    @Override
    public String toString() {
        return "Squad{lineup=" + lineup.stream().map(Player::getId).toList()
                + ", bench=" + benchOrder()
                + ", captain=" + captainId + ", vice=" + viceCaptainId + "}";
    }
}
