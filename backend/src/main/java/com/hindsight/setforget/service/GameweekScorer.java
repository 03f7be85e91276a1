package com.hindsight.setforget.service;

import com.hindsight.setforget.dto.GameweekResult;
import com.hindsight.setforget.dto.Substitution;
import com.hindsight.setforget.exception.MalformedPlayerDataException;
import com.hindsight.setforget.model.GameweekPerformance;
import com.hindsight.setforget.model.Player;
import com.hindsight.setforget.model.Position;
import com.hindsight.setforget.model.Squad;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Replays one gameweek for a fixed squad: featured starters score, the captain's points count twice (or the
 * vice-captain's when the captain did not feature), and non-featured starters are replaced from the bench.
 * <p>
 * Outfield replacements must come from the same position while the surviving count of that position is at or
 * below its floor; above the floor the next substitute of any position comes on. Substitutes are consumed in bench
 * order whether or not they played themselves, and score their own points. The bench goalkeeper only ever replaces
 * the starting goalkeeper, and always does.
 * <p>
 * Stateless apart from the last completed gameweek; gameweeks after it score nothing.
 */
public class GameweekScorer {

    static final Map<Position, Integer> SAME_POSITION_FLOOR = Map.of(
            Position.DEF, 3,
            Position.MID, 2,
            Position.FWD, 1);

    private final int lastCompletedGameweek;

    public GameweekScorer(int lastCompletedGameweek) {
        this.lastCompletedGameweek = lastCompletedGameweek;
    }

    public int getLastCompletedGameweek() { return lastCompletedGameweek; }

    public GameweekResult score(Squad squad, int gameweek) {
        if (gameweek > lastCompletedGameweek) {
            return GameweekResult.notPlayed(gameweek);
        }

        int points = 0;
        List<Player> absent = new ArrayList<>();
        Map<Position, Integer> surviving = new EnumMap<>(Position.class);
        for (Position p : Position.values()) surviving.put(p, 0);

        for (Player starter : squad.getLineup()) {
            GameweekPerformance perf = performance(starter, gameweek);
            if (perf.featured()) {
                points += perf.points();
                surviving.merge(starter.getPosition(), 1, Integer::sum);
            } else {
                absent.add(starter);
            }
        }

        boolean captainFeatured = false;
        boolean viceUsedAsCaptain = false;
        GameweekPerformance captain = performance(squad.getCaptain(), gameweek);
        if (captain.featured()) {
            points += captain.points();
            captainFeatured = true;
        } else {
            GameweekPerformance vice = performance(squad.getViceCaptain(), gameweek);
            if (vice.featured()) {
                points += vice.points();
                viceUsedAsCaptain = true;
            }
        }

        List<Substitution> substitutions = new ArrayList<>();
        List<Long> unfilled = new ArrayList<>();
        Player benchGoalkeeper = squad.getBenchGoalkeeper();
        boolean goalkeeperSlotUsed = false;
        LinkedList<Player> bench = new LinkedList<>(squad.getOutfieldBench());

        for (Player out : absent) {
            Optional<Player> in;
            if (out.getPosition() == Position.GK) {
                in = goalkeeperSlotUsed ? Optional.empty() : Optional.of(benchGoalkeeper);
                goalkeeperSlotUsed = true;
            } else {
                boolean atFloor = surviving.get(out.getPosition()) <= SAME_POSITION_FLOOR.get(out.getPosition());
                in = takeFromBench(bench, atFloor ? out.getPosition() : null);
            }

            if (in.isPresent()) {
                Player sub = in.get();
                points += performance(sub, gameweek).points();
                surviving.merge(sub.getPosition(), 1, Integer::sum);
                substitutions.add(new Substitution(out.getId(), sub.getId()));
            } else {
                unfilled.add(out.getId());
            }
        }

        return new GameweekResult(gameweek, points, substitutions, unfilled, captainFeatured, viceUsedAsCaptain);
    }

    /** Removes and returns the first bench player, restricted to {@code position} when it is non-null. */
    private static Optional<Player> takeFromBench(LinkedList<Player> bench, Position position) {
        Iterator<Player> it = bench.iterator();
        while (it.hasNext()) {
            Player candidate = it.next();
            if (position != null && candidate.getPosition() != position) continue;
            it.remove();
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    private GameweekPerformance performance(Player player, int gameweek) {
        return player.performance(gameweek).orElseThrow(() ->
                new MalformedPlayerDataException("Player " + player.getId() + " has no record for gameweek " + gameweek));
    }
}
