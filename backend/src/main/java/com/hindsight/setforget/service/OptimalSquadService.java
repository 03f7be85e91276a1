package com.hindsight.setforget.service;

import com.hindsight.setforget.dto.SearchResult;
import com.hindsight.setforget.model.OptimalSquadMember;
import com.hindsight.setforget.model.Player;
import com.hindsight.setforget.model.Squad;
import com.hindsight.setforget.repository.OptimalSquadMemberRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores and reads back the final squad of a search, one row per member.
 */
@Service
public class OptimalSquadService {
    private static final Logger log = LoggerFactory.getLogger(OptimalSquadService.class);

    private final OptimalSquadMemberRepository repository;

    public OptimalSquadService(OptimalSquadMemberRepository repository) {
        this.repository = repository;
    }

    @Transactional
    public List<OptimalSquadMember> save(String jobId, SearchResult result) {
        repository.deleteByJobId(jobId);
        // removals must reach the table before the new rows hit the (job_id, player_id) constraint
        repository.flush();
        List<OptimalSquadMember> saved = repository.saveAll(toRows(jobId, result.seasonName(), result.squad()));
        log.info("[OptimalSquad][Saved] jobId={} season={} rows={}", jobId, result.seasonName(), saved.size());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<OptimalSquadMember> forJob(String jobId) {
        return repository.findByJobIdOrderByIdAsc(jobId);
    }

    /** Rows of the most recently stored squad for the season, empty when none exists. */
    @Transactional(readOnly = true)
    public List<OptimalSquadMember> latestForSeason(String season) {
        return repository.findFirstBySeasonOrderByCreatedAtDescIdDesc(season)
                .map(latest -> repository.findByJobIdOrderByIdAsc(latest.getJobId()))
                .orElse(List.of());
    }

    /** Lineup in formation order, then the bench in bench order (goalkeeper first). */
    public static List<OptimalSquadMember> toRows(String jobId, String season, Squad squad) {
        Instant now = Instant.now();
        List<OptimalSquadMember> rows = new ArrayList<>(Squad.SQUAD_SIZE);
        List<Player> lineup = new ArrayList<>(squad.getLineup());
        lineup.sort(Squad.FORMATION_ORDER);
        for (int i = 0; i < lineup.size(); i++) {
            rows.add(row(jobId, season, squad, lineup.get(i), i, now));
        }
        List<Player> bench = squad.getBench();
        for (int i = 0; i < bench.size(); i++) {
            rows.add(row(jobId, season, squad, bench.get(i), i, now));
        }
        return rows;
    }

    private static OptimalSquadMember row(String jobId, String season, Squad squad, Player p,
                                          int slot, Instant createdAt) {
        OptimalSquadMember m = new OptimalSquadMember();
        m.setJobId(jobId);
        m.setSeason(season);
        m.setPlayerId(p.getId());
        m.setPlayerName(p.getName());
        m.setPosition(p.getPosition());
        m.setClub(p.getClub());
        m.setStartCost(p.getCost());
        m.setInLineup(squad.inLineup(p.getId()));
        m.setOnBench(squad.onBench(p.getId()));
        m.setCaptain(p.getId() == squad.getCaptainId());
        m.setViceCaptain(p.getId() == squad.getViceCaptainId());
        m.setSlot(slot);
        m.setCreatedAt(createdAt);
        return m;
    }
}
