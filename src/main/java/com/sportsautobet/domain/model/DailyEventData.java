package com.sportsautobet.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Raw events collected for one date, grouped by sport.
 * Raw events keep the provider's JSON shape; nothing here validates them.
 */
public class DailyEventData {

    /** Wire key of the collection date in the input document. */
    public static final String DATE_KEY = "data_raccolta";

    private final String date;
    private final Map<Sport, List<JsonNode>> eventsBySport = new EnumMap<>(Sport.class);

    public DailyEventData(String date) {
        this.date = date;
    }

    /**
     * Reads the input document: one array per sport key plus the date string.
     * Missing, null or non-array sport entries count as no events.
     */
    public static DailyEventData fromJson(JsonNode root) {
        String date = root != null && root.hasNonNull(DATE_KEY) ? root.get(DATE_KEY).asText() : null;
        DailyEventData data = new DailyEventData(date);
        if (root == null) {
            return data;
        }
        for (Sport sport : Sport.values()) {
            JsonNode events = root.get(sport.getKey());
            if (events != null && events.isArray()) {
                List<JsonNode> list = new ArrayList<>();
                events.forEach(list::add);
                data.put(sport, list);
            }
        }
        return data;
    }

    public String getDate() {
        return date;
    }

    public void put(Sport sport, List<JsonNode> events) {
        eventsBySport.put(sport, events == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(events)));
    }

    /**
     * Events for the sport in provider order; never null.
     */
    public List<JsonNode> eventsFor(Sport sport) {
        List<JsonNode> events = eventsBySport.get(sport);
        return events == null ? Collections.emptyList() : events;
    }

    public int totalEvents() {
        int total = 0;
        for (List<JsonNode> events : eventsBySport.values()) {
            total += events.size();
        }
        return total;
    }
}
