package com.hindsight.setforget.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable snapshot of one player's season: identity, start-of-season cost (tenths) and per-gameweek record.
 */
public final class Player {

    private final long id;
    private final String name;
    private final Position position;
    private final String club;
    private final int cost;
    private final Map<Integer, GameweekPerformance> gameweeks;

    public Player(long id, String name, Position position, String club, int cost,
                  Map<Integer, GameweekPerformance> gameweeks) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.position = Objects.requireNonNull(position, "position");
        this.club = Objects.requireNonNull(club, "club");
        this.cost = cost;
        this.gameweeks = Collections.unmodifiableMap(new TreeMap<>(gameweeks));
    }

    public long getId() { return id; }
    public String getName() { return name; }
    public Position getPosition() { return position; }
    public String getClub() { return club; }
    public int getCost() { return cost; }
    public Map<Integer, GameweekPerformance> getGameweeks() { return gameweeks; }

    public Optional<GameweekPerformance> performance(int gameweek) {
        return Optional.ofNullable(gameweeks.get(gameweek));
    }

    /** Sum of points over the inclusive range; gameweeks without a record count as zero. */
    public int totalPoints(int fromGameweek, int toGameweek) {
        int total = 0;
        for (int gw = fromGameweek; gw <= toGameweek; gw++) {
            GameweekPerformance p = gameweeks.get(gw);
            if (p != null) total += p.points();
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Player)) return false;
        return id == ((Player) o).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return name + " (" + position + ", " + club + ", #" + id + ")";
    }
}
