package com.hindsight.setforget.repository;

import com.hindsight.setforget.SquadFixtures;
import com.hindsight.setforget.dto.SearchResult;
import com.hindsight.setforget.dto.SeasonSimulation;
import com.hindsight.setforget.model.OptimalSquadMember;
import com.hindsight.setforget.model.Squad;
import com.hindsight.setforget.service.OptimalSquadService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
class OptimalSquadMemberRepositoryTest {

    @Autowired private OptimalSquadMemberRepository repository;

    private OptimalSquadService service;

    @BeforeEach
    void setUp() {
        service = new OptimalSquadService(repository);
    }

    @Test
    void savesFifteenRowsAndReadsThemBackInSlotOrder() {
        Squad squad = SquadFixtures.sampleSquad();

        service.save("job-a", result("2023-2024", squad));

        List<OptimalSquadMember> rows = service.forJob("job-a");
        assertThat(rows).hasSize(15);
        assertThat(rows.subList(0, 11)).allMatch(m -> m.isInLineup() && !m.isOnBench());
        assertThat(rows.subList(11, 15)).allMatch(m -> m.isOnBench() && !m.isInLineup());
        assertThat(rows.subList(11, 15)).extracting(OptimalSquadMember::getPlayerId)
                .containsExactlyElementsOf(squad.benchOrder());
        assertThat(rows).filteredOn(OptimalSquadMember::isCaptain).singleElement()
                .extracting(OptimalSquadMember::getPlayerId).isEqualTo(squad.getCaptainId());
    }

    @Test
    void savingTheSameJobTwiceReplacesItsRows() {
        Squad squad = SquadFixtures.sampleSquad();

        service.save("job-a", result("2023-2024", squad));
        service.save("job-a", result("2023-2024", squad.withCaptaincy(3, 4)));

        List<OptimalSquadMember> rows = service.forJob("job-a");
        assertThat(rows).hasSize(15);
        assertThat(rows).filteredOn(OptimalSquadMember::isCaptain).singleElement()
                .extracting(OptimalSquadMember::getPlayerId).isEqualTo(3L);
    }

    @Test
    void latestForSeasonPicksNewestJob() {
        Squad squad = SquadFixtures.sampleSquad();
        List<OptimalSquadMember> older = OptimalSquadService.toRows("job-old", "2023-2024", squad);
        older.forEach(m -> m.setCreatedAt(Instant.now().minusSeconds(3600)));
        repository.saveAll(older);
        service.save("job-new", result("2023-2024", squad.withCaptaincy(5, 6)));
        service.save("job-other", result("2022-2023", squad));

        List<OptimalSquadMember> latest = service.latestForSeason("2023-2024");

        assertThat(latest).hasSize(15).allSatisfy(m -> assertThat(m.getJobId()).isEqualTo("job-new"));
        assertThat(service.latestForSeason("1999-2000")).isEmpty();
    }

    private static SearchResult result(String season, Squad squad) {
        return new SearchResult(season, 1, 0.5, squad, 0, 0, SeasonSimulation.of(List.of()), List.of());
    }
}
