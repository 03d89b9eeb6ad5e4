package com.sportsautobet.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DailyEventData.
 */
class DailyEventDataTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testReadsSportsAndDate() throws Exception {
        DailyEventData data = DailyEventData.fromJson(mapper.readTree(
            "{\"data_raccolta\":\"2025-05-04\",\"football\":[{\"a\":1},{\"b\":2}],\"volleyball\":[{}]}"));

        assertEquals("2025-05-04", data.getDate());
        assertEquals(2, data.eventsFor(Sport.FOOTBALL).size());
        assertEquals(1, data.eventsFor(Sport.VOLLEYBALL).size());
        assertEquals(3, data.totalEvents());
    }

    @Test
    void testAbsentOrNullSportsAreEmpty() throws Exception {
        DailyEventData data = DailyEventData.fromJson(mapper.readTree(
            "{\"football\":null,\"basketball\":{\"not\":\"a list\"}}"));

        assertNull(data.getDate());
        for (Sport sport : Sport.values()) {
            assertTrue(data.eventsFor(sport).isEmpty());
        }
        assertTrue(DailyEventData.fromJson(null).eventsFor(Sport.TENNIS).isEmpty());
    }

    @Test
    void testPutCopiesAndToleratesNull() {
        DailyEventData data = new DailyEventData("2025-05-04");
        data.put(Sport.TENNIS, null);

        assertEquals(List.of(), data.eventsFor(Sport.TENNIS));
        assertThrows(UnsupportedOperationException.class,
            () -> data.eventsFor(Sport.FOOTBALL).add(mapper.createObjectNode()));
    }
}
