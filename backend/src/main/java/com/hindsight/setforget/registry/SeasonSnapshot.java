package com.hindsight.setforget.registry;

import com.hindsight.setforget.exception.MalformedPlayerDataException;
import com.hindsight.setforget.model.GameweekPerformance;
import com.hindsight.setforget.model.Player;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Player pool for one season, loaded once and read-only afterwards. Every player carries a record for each
 * gameweek in {@code [fromGameweek, toGameweek]}; the constructor rejects anything else.
 */
public final class SeasonSnapshot {

    private final String seasonName;
    private final int fromGameweek;
    private final int toGameweek;
    private final List<Player> players;

    public SeasonSnapshot(String seasonName, int fromGameweek, int toGameweek, List<Player> players) {
        if (fromGameweek < 1 || toGameweek < fromGameweek) {
            throw new MalformedPlayerDataException("Invalid gameweek range [" + fromGameweek + ", " + toGameweek + "]");
        }
        this.seasonName = seasonName;
        this.fromGameweek = fromGameweek;
        this.toGameweek = toGameweek;
        this.players = List.copyOf(players);
        validate();
    }

    private void validate() {
        Set<Long> ids = new HashSet<>();
        for (Player p : players) {
            if (!ids.add(p.getId())) {
                throw new MalformedPlayerDataException("Duplicate player id " + p.getId());
            }
            if (p.getCost() < 0) {
                throw new MalformedPlayerDataException("Negative cost " + p.getCost() + " for player " + p.getId());
            }
            for (int gw = fromGameweek; gw <= toGameweek; gw++) {
                GameweekPerformance perf = p.getGameweeks().get(gw);
                if (perf == null) {
                    throw new MalformedPlayerDataException("Player " + p.getId() + " has no record for gameweek " + gw);
                }
            }
        }
    }

    public String getSeasonName() { return seasonName; }
    public int getFromGameweek() { return fromGameweek; }

    /** Last completed gameweek covered by this snapshot. */
    public int getLastCompletedGameweek() { return toGameweek; }

    public List<Player> getPlayers() { return players; }
}
