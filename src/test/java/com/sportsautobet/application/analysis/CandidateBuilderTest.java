package com.sportsautobet.application.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.sportsautobet.domain.model.Candidate;
import com.sportsautobet.domain.model.DailyEventData;
import com.sportsautobet.domain.model.Sport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CandidateBuilder.
 */
class CandidateBuilderTest {

    private final CandidateBuilder builder = new CandidateBuilder();

    @Test
    void testFootballEventWithTopTierLeague() {
        Candidate candidate = builder.build(SportProfiles.FOOTBALL,
            RawEvents.football("Inter", "Milan", "Serie A", "1.80", "4.50"));

        // Blended home probability 0.6*0.714 + 0.3*0.5 + 0.1*0.55
        assertEquals(0.6336, CandidateBuilder.blend(1.0 / 1.8 / (1.0 / 1.8 + 1.0 / 4.5), 0.5, 0.55), 1e-4);

        // The away side carries more value at 4.50, so it is the pick
        assertEquals(Sport.FOOTBALL, candidate.getSport());
        assertEquals("1X2", candidate.getMarket());
        assertEquals("2", candidate.getPick());
        assertEquals("Inter vs Milan", candidate.getEventLabel());
        assertEquals("Serie A", candidate.getLeague());
        assertEquals("2025-05-04T18:45:00+00:00", candidate.getStartTime());
        assertEquals(4.5, candidate.getOdds());
        assertEquals(0.366, candidate.getProbability());
        assertEquals(0.649, candidate.getConfidence());
        assertTrue(candidate.getRationale().contains("Milan"));
        assertTrue(candidate.getRationale().contains("0.93"));
    }

    @Test
    void testHomeSideWhenItHasMoreValue() {
        Candidate candidate = builder.build(SportProfiles.FOOTBALL,
            RawEvents.football("PSV", "Feyenoord", "Eredivisie", "3.00", "1.40"));

        assertEquals("1", candidate.getPick());
        assertEquals(3.0, candidate.getOdds());
        assertEquals(0.391, candidate.getProbability());
        assertEquals(0.529, candidate.getConfidence());
        assertEquals("PSV favoured by the odds model, value score 0.67", candidate.getRationale());
    }

    @Test
    void testEventWithNothingUsableStillYieldsCandidate() {
        Candidate candidate = builder.build(SportProfiles.FOOTBALL, RawEvents.MAPPER.createObjectNode());

        assertEquals("Home vs Away", candidate.getEventLabel());
        assertEquals("1", candidate.getPick());
        assertNull(candidate.getOdds());
        assertNull(candidate.getStartTime());
        assertEquals("", candidate.getLeague());
        assertEquals(0.5, candidate.getProbability());
        assertEquals(0.25, candidate.getConfidence());
        assertTrue(candidate.getRationale().contains("Home"));
        assertTrue(candidate.getRationale().contains("0.00"));
    }

    @Test
    void testNullEventStillYieldsCandidate() {
        Candidate candidate = builder.build(SportProfiles.BASKETBALL, null);

        assertEquals("Home vs Away", candidate.getEventLabel());
        assertEquals("Home", candidate.getPick());
        assertEquals(0.25, candidate.getConfidence());
    }

    @Test
    void testUnreadableOddsScoreLikeMissingOdds() {
        Candidate candidate = builder.build(SportProfiles.FOOTBALL,
            RawEvents.football("Lazio", "Roma", "Serie A", "1.90", "suspended"));

        assertNull(candidate.getOdds());
        assertEquals("1", candidate.getPick());
        // League prior still applies: 0.3 + 0.15 + 0.055
        assertEquals(0.505, candidate.getProbability());
    }

    @Test
    void testLeagueMarkerOnlyAppliesToFootball() {
        Candidate premier = builder.build(SportProfiles.FOOTBALL,
            RawEvents.football("Arsenal", "Chelsea", "Premier League", "2.00", "2.00"));
        Candidate other = builder.build(SportProfiles.FOOTBALL,
            RawEvents.football("Leeds", "Burnley", "Championship", "2.00", "2.00"));
        Candidate lowerCase = builder.build(SportProfiles.FOOTBALL,
            RawEvents.football("Bari", "Pisa", "serie b", "2.00", "2.00"));
        Candidate basketball = builder.build(SportProfiles.BASKETBALL,
            RawEvents.game("Virtus", "Olimpia", "Serie A", "2.00", "2.00"));

        assertEquals(0.505, premier.getProbability());
        assertEquals(0.5, other.getProbability());
        assertEquals(0.5, lowerCase.getProbability());
        assertEquals(0.5, basketball.getProbability());
    }

    @Test
    void testEvenOddsTieGoesHome() {
        Candidate candidate = builder.build(SportProfiles.VOLLEYBALL,
            RawEvents.game("Modena", "Piacenza", "SuperLega", "2.00", "2.00"));

        assertEquals("ML", candidate.getMarket());
        assertEquals("Home", candidate.getPick());
        assertEquals("2025-05-04T20:30:00+00:00", candidate.getStartTime());
    }

    @Test
    void testMoneylinePicks() {
        Candidate basketball = builder.build(SportProfiles.BASKETBALL,
            RawEvents.game("Lakers", "Celtics", "NBA", "1.50", "2.60"));
        Candidate volleyball = builder.build(SportProfiles.VOLLEYBALL,
            RawEvents.game("Trentino", "Perugia", "SuperLega", "2.10", "1.75"));

        assertEquals("Away", basketball.getPick());
        assertEquals(0.42, basketball.getProbability());
        assertEquals(0.505, basketball.getConfidence());
        assertEquals("Home", volleyball.getPick());
        assertEquals(0.473, volleyball.getProbability());
        assertEquals(0.483, volleyball.getConfidence());
    }

    @Test
    void testProbabilityTieRoundsToEven() {
        // Away blend is exactly 0.6*0.2 + 0.15 + 0.05 = 0.3125
        Candidate candidate = builder.build(SportProfiles.BASKETBALL,
            RawEvents.game("Lakers", "Celtics", "NBA", "1.05", "4.55"));

        assertEquals("Away", candidate.getPick());
        assertEquals(4.55, candidate.getOdds());
        assertEquals(0.312, candidate.getProbability());
        assertEquals(0.578, candidate.getConfidence());
    }

    @Test
    void testScoresStayInUnitRange() {
        String[] odds = {null, "1.01", "1.30", "2.00", "5.00", "15.0", "101"};
        for (String home : odds) {
            for (String away : odds) {
                Candidate c = builder.build(SportProfiles.FOOTBALL, RawEvents.football("A", "B", "Serie A", home, away));
                assertTrue(c.getProbability() >= 0.0 && c.getProbability() <= 1.0);
                assertTrue(c.getConfidence() >= 0.0 && c.getConfidence() <= 1.0);
            }
        }
    }

    @Test
    void testBuildAllOneCandidatePerEventInSportOrder() {
        DailyEventData data = new DailyEventData("2025-05-04");
        data.put(Sport.VOLLEYBALL, List.of(RawEvents.game("V1", "V2", "SuperLega", "2.1", "1.75")));
        data.put(Sport.TENNIS, List.<JsonNode>of(RawEvents.game("T1", "T2", "ATP", "1.5", "2.5")));
        data.put(Sport.FOOTBALL, List.of(
            RawEvents.football("F1", "F2", "Serie A", "1.8", "4.5"),
            RawEvents.MAPPER.createObjectNode()));

        List<Candidate> candidates = builder.buildAll(data);

        assertEquals(3, candidates.size());
        assertEquals("F1 vs F2", candidates.get(0).getEventLabel());
        assertEquals("Home vs Away", candidates.get(1).getEventLabel());
        assertEquals("V1 vs V2", candidates.get(2).getEventLabel());
    }

    @Test
    void testBuildAllOnEmptyData() {
        assertTrue(builder.buildAll(new DailyEventData("2025-05-04")).isEmpty());
    }
}
