package com.hindsight.setforget.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.hindsight.setforget.exception.MalformedPlayerDataException;
import com.hindsight.setforget.model.GameweekPerformance;
import com.hindsight.setforget.model.Player;
import com.hindsight.setforget.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads players and per-gameweek results from the public Fantasy Premier League API.
 */
@Service
public class FplApiPlayerRegistry implements PlayerRegistry {
    private static final Logger log = LoggerFactory.getLogger(FplApiPlayerRegistry.class);

    private final RestClient client;

    public FplApiPlayerRegistry(RestClient.Builder builder,
                                @Value("${hindsight.fpl.base-url:https://fantasy.premierleague.com/api}") String baseUrl) {
        this.client = builder.baseUrl(baseUrl).build();
    }

    @Override
    public int lastCompletedGameweek() {
        return lastCompletedGameweek(bootstrap());
    }

    @Override
    public SeasonSnapshot snapshot(int fromGameweek, int toGameweek) {
        JsonNode bootstrap = bootstrap();
        int lastCompleted = lastCompletedGameweek(bootstrap);
        int from = Math.max(1, fromGameweek);
        int to = Math.min(toGameweek, lastCompleted);
        if (to < from) {
            throw new IllegalArgumentException("No completed gameweeks in [" + fromGameweek + ", " + toGameweek
                    + "]; last completed is " + lastCompleted);
        }
        String season = seasonName(bootstrap);
        log.info("[Registry][Snapshot] season={} requested=[{}, {}] clamped=[{}, {}]", season, fromGameweek, toGameweek, from, to);

        Map<Integer, String> clubs = new HashMap<>();
        for (JsonNode team : bootstrap.path("teams")) {
            clubs.put(requiredInt(team, "code"), requiredText(team, "short_name"));
        }

        Map<Long, Map<Integer, GameweekPerformance>> history = new HashMap<>();
        for (int gw = from; gw <= to; gw++) {
            JsonNode live = get("/event/{gw}/live/", gw);
            int seen = 0;
            for (JsonNode element : live.path("elements")) {
                long id = requiredInt(element, "id");
                JsonNode stats = element.path("stats");
                int minutes = requiredInt(stats, "minutes");
                if (minutes < 0) {
                    throw new MalformedPlayerDataException("Negative minutes for player " + id + " in gameweek " + gw);
                }
                history.computeIfAbsent(id, k -> new HashMap<>())
                        .put(gw, new GameweekPerformance(requiredInt(stats, "total_points"), minutes));
                seen++;
            }
            log.debug("[Registry][Live] gameweek={} elements={}", gw, seen);
        }

        List<Player> players = new ArrayList<>();
        for (JsonNode element : bootstrap.path("elements")) {
            long id = requiredInt(element, "id");
            int typeCode = requiredInt(element, "element_type");
            Position position = Position.fromCode(typeCode)
                    .orElseThrow(() -> new MalformedPlayerDataException("Unknown element_type " + typeCode + " for player " + id));
            int teamCode = requiredInt(element, "team_code");
            String club = clubs.get(teamCode);
            if (club == null) {
                throw new MalformedPlayerDataException("Unknown team_code " + teamCode + " for player " + id);
            }
            int startCost = requiredInt(element, "now_cost") - requiredInt(element, "cost_change_start");

            Map<Integer, GameweekPerformance> gameweeks = new HashMap<>();
            Map<Integer, GameweekPerformance> recorded = history.getOrDefault(id, Map.of());
            for (int gw = from; gw <= to; gw++) {
                // players absent from a live feed took no part that gameweek
                gameweeks.put(gw, recorded.getOrDefault(gw, GameweekPerformance.DID_NOT_PLAY));
            }
            players.add(new Player(id, requiredText(element, "web_name"), position, club, startCost, gameweeks));
        }
        log.info("[Registry][Snapshot] season={} players={} gameweeks={}", season, players.size(), to - from + 1);
        return new SeasonSnapshot(season, from, to, players);
    }

    private JsonNode bootstrap() {
        return get("/bootstrap-static/");
    }

    private JsonNode get(String path, Object... uriVariables) {
        try {
            JsonNode body = client.get().uri(path, uriVariables).retrieve().body(JsonNode.class);
            if (body == null) throw new MalformedPlayerDataException("Empty response from " + path);
            return body;
        } catch (RestClientException e) {
            throw new MalformedPlayerDataException("FPL API call failed for " + path + ": " + e.getMessage(), e);
        }
    }

    static int lastCompletedGameweek(JsonNode bootstrap) {
        int last = 0;
        for (JsonNode event : bootstrap.path("events")) {
            if (event.path("finished").asBoolean(false)) {
                last = Math.max(last, requiredInt(event, "id"));
            }
        }
        return last;
    }

    static String seasonName(JsonNode bootstrap) {
        JsonNode first = bootstrap.path("events").path(0);
        String deadline = requiredText(first, "deadline_time");
        if (deadline.length() < 4) throw new MalformedPlayerDataException("Unparseable deadline_time " + deadline);
        try {
            int year = Integer.parseInt(deadline.substring(0, 4));
            return year + "-" + (year + 1);
        } catch (NumberFormatException e) {
            throw new MalformedPlayerDataException("Unparseable deadline_time " + deadline, e);
        }
    }

    private static int requiredInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt()) {
            throw new MalformedPlayerDataException("Missing or non-integer field '" + field + "'");
        }
        return value.intValue();
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new MalformedPlayerDataException("Missing or non-text field '" + field + "'");
        }
        return value.asText();
    }
}
