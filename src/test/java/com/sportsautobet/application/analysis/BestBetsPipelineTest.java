package com.sportsautobet.application.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.sportsautobet.domain.model.Candidate;
import com.sportsautobet.domain.model.DailyEventData;
import com.sportsautobet.domain.model.DailySelection;
import com.sportsautobet.domain.model.Sport;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BestBetsPipeline.
 */
class BestBetsPipelineTest {

    private final BestBetsPipeline pipeline = new BestBetsPipeline();

    private static DailyEventData loadFixture() throws IOException {
        try (InputStream in = BestBetsPipelineTest.class.getResourceAsStream("/fixtures/daily-events.json")) {
            assertNotNull(in, "fixture missing");
            return DailyEventData.fromJson(RawEvents.MAPPER.readTree(in));
        }
    }

    @Test
    void testFullDay() throws IOException {
        DailySelection selection = pipeline.run(loadFixture());

        assertEquals("2025-05-04", selection.getDate());
        List<Candidate> picks = selection.getPicks();
        assertEquals(3, picks.size());

        // PSV vs Feyenoord (0.529) would be a third football pick and is skipped
        assertEquals("Inter vs Milan", picks.get(0).getEventLabel());
        assertEquals(0.649, picks.get(0).getConfidence());

        assertEquals("Ajax vs Volendam", picks.get(1).getEventLabel());
        assertEquals("2", picks.get(1).getPick());
        assertEquals(6.0, picks.get(1).getOdds());
        assertEquals(0.58, picks.get(1).getConfidence());

        assertEquals("Los Angeles Lakers vs Boston Celtics", picks.get(2).getEventLabel());
        assertEquals(Sport.BASKETBALL, picks.get(2).getSport());
        assertEquals("Away", picks.get(2).getPick());
        assertEquals(0.505, picks.get(2).getConfidence());
    }

    @Test
    void testEmptyInputForAllSports() {
        JsonNode input = RawEvents.parse(
            "{\"data_raccolta\":\"2025-05-05\",\"football\":[],\"basketball\":[],\"tennis\":[],\"volleyball\":[]}");

        DailySelection selection = pipeline.run(DailyEventData.fromJson(input));

        assertEquals("2025-05-05", selection.getDate());
        assertFalse(selection.hasPicks());
    }

    @Test
    void testRunsAreIndependentAndRepeatable() throws IOException {
        DailySelection first = pipeline.run(loadFixture());
        DailySelection second = pipeline.run(loadFixture());

        assertEquals(first.getPicks().size(), second.getPicks().size());
        for (int i = 0; i < first.getPicks().size(); i++) {
            assertEquals(first.getPicks().get(i).getEventLabel(), second.getPicks().get(i).getEventLabel());
            assertEquals(first.getPicks().get(i).getConfidence(), second.getPicks().get(i).getConfidence());
        }
    }
}
