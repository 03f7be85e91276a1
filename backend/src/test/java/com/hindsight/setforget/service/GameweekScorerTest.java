package com.hindsight.setforget.service;

import com.hindsight.setforget.SquadFixtures;
import com.hindsight.setforget.dto.GameweekResult;
import com.hindsight.setforget.dto.Substitution;
import com.hindsight.setforget.exception.MalformedPlayerDataException;
import com.hindsight.setforget.model.GameweekPerformance;
import com.hindsight.setforget.model.Position;
import com.hindsight.setforget.model.Squad;
import org.junit.jupiter.api.Test;

import static com.hindsight.setforget.SquadFixtures.absent;
import static com.hindsight.setforget.SquadFixtures.played;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameweekScorerTest {

    private final GameweekScorer scorer = new GameweekScorer(1);

    @Test
    void allStartersFeatured_noSubstitutionsAndCaptainCountsTwice() {
        SquadFixtures.Builder b = SquadFixtures.builder();
        b.starter(Position.GK, played(5));
        b.starters(Position.DEF, 4, played(2));
        long captain = b.starter(Position.MID, played(10));
        b.starters(Position.MID, 3, played(3));
        b.starters(Position.FWD, 2, played(4));
        b.benchGoalkeeper(played(7));
        b.sub(Position.DEF, played(9));
        b.sub(Position.MID, played(9));
        b.sub(Position.FWD, played(9));
        Squad squad = b.captain(captain).vice(1).build();

        GameweekResult result = scorer.score(squad, 1);

        // 5 + 4*2 + 10 + 3*3 + 2*4 = 40, plus the captain's 10 again
        assertThat(result.points()).isEqualTo(50);
        assertThat(result.substitutions()).isEmpty();
        assertThat(result.unfilled()).isEmpty();
        assertThat(result.captainFeatured()).isTrue();
        assertThat(result.viceUsedAsCaptain()).isFalse();
    }

    @Test
    void captainAbsent_viceCountsTwice() {
        SquadFixtures.Builder b = standardThreeFourThree(played(2));
        long captain = b.starter(Position.FWD, absent());
        long vice = b.starter(Position.FWD, played(6));
        b.starter(Position.FWD, played(1));
        addBench(b, absent(), absent(), absent());
        Squad squad = b.captain(captain).vice(vice).build();

        GameweekResult result = scorer.score(squad, 1);

        // 1 GK + 3 DEF + 4 MID at 2 each, then 6 + 1 from forwards, plus the vice's 6 again
        assertThat(result.points()).isEqualTo(8 * 2 + 7 + 6);
        assertThat(result.captainFeatured()).isFalse();
        assertThat(result.viceUsedAsCaptain()).isTrue();
        // two forwards survive, so the first bench player comes on and scores 0
        assertThat(result.substitutions()).hasSize(1);
        assertThat(result.unfilled()).isEmpty();
    }

    @Test
    void captainAndViceAbsent_noBonus() {
        SquadFixtures.Builder b = standardThreeFourThree(played(2));
        long captain = b.starter(Position.FWD, absent());
        long vice = b.starter(Position.FWD, absent());
        b.starter(Position.FWD, played(1));
        addBench(b, absent(), absent(), absent());
        Squad squad = b.captain(captain).vice(vice).build();

        GameweekResult result = scorer.score(squad, 1);

        assertThat(result.points()).isEqualTo(8 * 2 + 1);
        assertThat(result.captainFeatured()).isFalse();
        assertThat(result.viceUsedAsCaptain()).isFalse();
    }

    @Test
    void goalkeeperAbsent_benchGoalkeeperComesOnOnce() {
        SquadFixtures.Builder b = SquadFixtures.builder();
        long gk = b.starter(Position.GK, absent());
        b.starters(Position.DEF, 3, played(2));
        long captain = b.starter(Position.MID, played(2));
        b.starters(Position.MID, 3, played(2));
        b.starters(Position.FWD, 3, played(2));
        long benchGk = b.benchGoalkeeper(played(3));
        b.sub(Position.DEF, played(8));
        b.sub(Position.DEF, played(8));
        b.sub(Position.MID, played(8));
        Squad squad = b.captain(captain).vice(2).build();

        GameweekResult result = scorer.score(squad, 1);

        assertThat(result.substitutions()).containsExactly(new Substitution(gk, benchGk));
        assertThat(result.points()).isEqualTo(10 * 2 + 2 + 3);
    }

    @Test
    void goalkeeperAbsent_benchGoalkeeperComesOnEvenWithoutPlaying_outfieldSubsNeverReplaceGoalkeeper() {
        SquadFixtures.Builder b = SquadFixtures.builder();
        long gk = b.starter(Position.GK, absent());
        b.starters(Position.DEF, 3, played(2));
        long captain = b.starter(Position.MID, played(2));
        b.starters(Position.MID, 3, played(2));
        b.starters(Position.FWD, 3, played(2));
        long benchGk = b.benchGoalkeeper(absent());
        b.sub(Position.DEF, played(8));
        b.sub(Position.DEF, played(8));
        b.sub(Position.MID, played(8));
        Squad squad = b.captain(captain).vice(2).build();

        GameweekResult result = scorer.score(squad, 1);

        assertThat(result.substitutions()).containsExactly(new Substitution(gk, benchGk));
        assertThat(result.unfilled()).isEmpty();
        assertThat(result.points()).isEqualTo(10 * 2 + 2);
    }

    @Test
    void defenderAtFloor_sameSubstitutePositionPreferredOverEarlierMidfielder() {
        SquadFixtures.Builder b = SquadFixtures.builder();
        b.starter(Position.GK, played(1));
        long missingDef = b.starter(Position.DEF, absent());
        b.starters(Position.DEF, 2, played(1));
        long captain = b.starter(Position.MID, played(1));
        b.starters(Position.MID, 3, played(1));
        b.starters(Position.FWD, 3, played(1));
        b.benchGoalkeeper(played(1));
        b.sub(Position.MID, played(9));
        long benchDef = b.sub(Position.DEF, played(4));
        b.sub(Position.DEF, played(5));
        Squad squad = b.captain(captain).vice(1).build();

        GameweekResult result = scorer.score(squad, 1);

        assertThat(result.substitutions()).containsExactly(new Substitution(missingDef, benchDef));
        // ten featured starters, the sub's 4 and the captain's 1 again
        assertThat(result.points()).isEqualTo(10 + 4 + 1);
    }

    @Test
    void defenderAboveFloor_firstSubstituteOfAnyPositionComesOn() {
        SquadFixtures.Builder b = SquadFixtures.builder();
        b.starter(Position.GK, played(1));
        long missingDef = b.starter(Position.DEF, absent());
        b.starters(Position.DEF, 4, played(1));
        long captain = b.starter(Position.MID, played(1));
        b.starters(Position.MID, 2, played(1));
        b.starters(Position.FWD, 2, played(1));
        b.benchGoalkeeper(played(1));
        long benchMid = b.sub(Position.MID, played(9));
        b.sub(Position.MID, played(2));
        b.sub(Position.FWD, played(2));
        Squad squad = b.captain(captain).vice(1).build();

        GameweekResult result = scorer.score(squad, 1);

        assertThat(result.substitutions()).containsExactly(new Substitution(missingDef, benchMid));
        assertThat(result.points()).isEqualTo(10 + 9 + 1);
    }

    @Test
    void midfielderAtFloor_onlyMidfielderMayReplace() {
        SquadFixtures.Builder b = SquadFixtures.builder();
        b.starter(Position.GK, played(1));
        b.starters(Position.DEF, 5, played(1));
        long missingMid = b.starter(Position.MID, absent());
        long captain = b.starter(Position.MID, played(1));
        b.starter(Position.MID, played(1));
        b.starters(Position.FWD, 2, played(1));
        b.benchGoalkeeper(played(1));
        b.sub(Position.FWD, played(6));
        long benchMid = b.sub(Position.MID, played(3));
        b.sub(Position.MID, played(3));
        Squad squad = b.captain(captain).vice(1).build();

        GameweekResult result = scorer.score(squad, 1);

        assertThat(result.substitutions()).containsExactly(new Substitution(missingMid, benchMid));
    }

    @Test
    void atFloor_firstSamePositionSubstituteComesOnEvenWithoutPlaying() {
        SquadFixtures.Builder b = SquadFixtures.builder();
        b.starter(Position.GK, played(1));
        long missingDef = b.starter(Position.DEF, absent());
        b.starters(Position.DEF, 2, played(2));
        long captain = b.starter(Position.MID, played(2));
        b.starters(Position.MID, 3, played(2));
        b.starters(Position.FWD, 3, played(2));
        b.benchGoalkeeper(played(1));
        long idleDef = b.sub(Position.DEF, absent());
        b.sub(Position.DEF, played(6));
        b.sub(Position.MID, played(6));
        Squad squad = b.captain(captain).vice(1).build();

        GameweekResult result = scorer.score(squad, 1);

        assertThat(result.substitutions()).containsExactly(new Substitution(missingDef, idleDef));
        // 1 + 9 starters at 2, the idle defender's 0 and the captain's 2 again
        assertThat(result.points()).isEqualTo(1 + 18 + 2);
    }

    @Test
    void secondAbsentDefenderStaysUnfilledOnceTheCountIsBackAtTheFloor() {
        SquadFixtures.Builder b = SquadFixtures.builder();
        b.starter(Position.GK, played(1));
        long firstMissing = b.starter(Position.DEF, absent());
        long secondMissing = b.starter(Position.DEF, absent());
        b.starters(Position.DEF, 2, played(1));
        long captain = b.starter(Position.MID, played(1));
        b.starters(Position.MID, 3, played(1));
        b.starters(Position.FWD, 2, played(1));
        b.benchGoalkeeper(played(1));
        b.sub(Position.MID, played(7));
        long benchDef = b.sub(Position.DEF, played(4));
        b.sub(Position.FWD, played(7));
        Squad squad = b.captain(captain).vice(1).build();

        GameweekResult result = scorer.score(squad, 1);

        // two defenders survive: the bench defender lifts the count back to 3, where same-position still applies
        assertThat(result.substitutions()).containsExactly(new Substitution(firstMissing, benchDef));
        assertThat(result.unfilled()).containsExactly(secondMissing);
        assertThat(result.points()).isEqualTo(9 + 4 + 1);
    }

    @Test
    void substituteOfAnotherPositionRaisesThatPositionsCount() {
        SquadFixtures.Builder b = SquadFixtures.builder();
        b.starter(Position.GK, played(1));
        long missingMid = b.starter(Position.MID, absent());
        long captain = b.starter(Position.MID, played(1));
        b.starters(Position.MID, 2, played(1));
        long missingDef = b.starter(Position.DEF, absent());
        b.starters(Position.DEF, 3, played(1));
        b.starters(Position.FWD, 2, played(1));
        b.benchGoalkeeper(played(1));
        long benchDef = b.sub(Position.DEF, played(3));
        long benchMid = b.sub(Position.MID, played(5));
        b.sub(Position.FWD, played(9));
        Squad squad = b.captain(captain).vice(1).build();

        GameweekResult result = scorer.score(squad, 1);

        // the defender who covers the midfielder takes the defender count to 4, above the floor
        assertThat(result.substitutions()).containsExactly(
                new Substitution(missingMid, benchDef),
                new Substitution(missingDef, benchMid));
        assertThat(result.unfilled()).isEmpty();
        assertThat(result.points()).isEqualTo(9 + 3 + 5 + 1);
    }

    @Test
    void substitutesComeOnInBenchOrderWhetherOrNotTheyPlayed() {
        SquadFixtures.Builder b = SquadFixtures.builder();
        b.starter(Position.GK, played(1));
        b.starters(Position.DEF, 3, played(1));
        long captain = b.starter(Position.MID, played(1));
        long missingMid1 = b.starter(Position.MID, absent());
        long missingMid2 = b.starter(Position.MID, absent());
        b.starters(Position.MID, 2, played(1));
        b.starters(Position.FWD, 2, played(1));
        b.benchGoalkeeper(played(1));
        long idleDef = b.sub(Position.DEF, absent());
        long benchFwd = b.sub(Position.FWD, played(4));
        long lastDef = b.sub(Position.DEF, played(3));
        Squad squad = b.captain(captain).vice(1).build();

        GameweekResult result = scorer.score(squad, 1);

        // three midfielders survive, above the floor for both absences
        assertThat(result.substitutions()).containsExactly(
                new Substitution(missingMid1, idleDef),
                new Substitution(missingMid2, benchFwd));
        assertThat(result.substitutions()).extracting(Substitution::inId).doesNotContain(lastDef);
        assertThat(result.unfilled()).isEmpty();
        assertThat(result.points()).isEqualTo(9 + 0 + 4 + 1);
    }

    @Test
    void gameweekAfterLastCompleted_scoresNothing() {
        Squad squad = allPlaying();

        GameweekResult result = scorer.score(squad, 2);

        assertThat(result).isEqualTo(GameweekResult.notPlayed(2));
    }

    @Test
    void scoringIsDeterministic() {
        Squad squad = allPlaying();

        assertThat(scorer.score(squad, 1)).isEqualTo(scorer.score(squad, 1));
    }

    @Test
    void missingRecordForCompletedGameweek_isMalformedData() {
        Squad squad = allPlaying();

        assertThatThrownBy(() -> new GameweekScorer(3).score(squad, 3))
                .isInstanceOf(MalformedPlayerDataException.class)
                .hasMessageContaining("gameweek 3");
    }

    @Test
    void pointsMayBeNegative() {
        SquadFixtures.Builder b = SquadFixtures.builder();
        b.starter(Position.GK, new GameweekPerformance(-2, 90));
        b.starters(Position.DEF, 3, played(0));
        long captain = b.starter(Position.MID, played(0));
        b.starters(Position.MID, 3, played(0));
        b.starters(Position.FWD, 3, played(0));
        addBench(b, played(0), played(0), played(0));
        Squad squad = b.captain(captain).vice(1).build();

        assertThat(scorer.score(squad, 1).points()).isEqualTo(-2);
    }

    private static SquadFixtures.Builder standardThreeFourThree(GameweekPerformance others) {
        SquadFixtures.Builder b = SquadFixtures.builder();
        b.starter(Position.GK, others);
        b.starters(Position.DEF, 3, others);
        b.starters(Position.MID, 4, others);
        return b;
    }

    private static void addBench(SquadFixtures.Builder b, GameweekPerformance gk, GameweekPerformance def,
                                 GameweekPerformance mid) {
        b.benchGoalkeeper(gk);
        b.sub(Position.DEF, def);
        b.sub(Position.DEF, def);
        b.sub(Position.MID, mid);
    }

    static Squad allPlaying() {
        SquadFixtures.Builder b = standardThreeFourThree(played(2));
        b.starters(Position.FWD, 3, played(2));
        addBench(b, played(1), played(1), played(1));
        return b.build();
    }
}
