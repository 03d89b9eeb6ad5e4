package com.sportsautobet.infrastructure.sportsdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sportsautobet.application.analysis.JsonPathExtractor;
import com.sportsautobet.domain.ports.SportsDataGateway;
import com.sportsautobet.infrastructure.http.HttpClientUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base gateway for the API-Sports family of APIs.
 *
 * Each sport has its own host but the same shape:
 * - GET {baseUrl}/odds?date=YYYY-MM-DD returns the bookmaker odds, paginated
 * - GET {baseUrl}{scheduleEndpoint}?date=YYYY-MM-DD returns the day's fixtures with team names
 *
 * Odds records are completed with the fields they lack from the matching schedule record, so the
 * returned events carry league, teams, start time and bookmakers in one object.
 */
public abstract class ApiSportsGateway implements SportsDataGateway {

    private static final Logger logger = LoggerFactory.getLogger(ApiSportsGateway.class);

    public static final String PLACEHOLDER_KEY = "YOUR_SPORTS_API_KEY_HERE";
    static final String API_KEY_HEADER = "x-apisports-key";
    static final int MAX_PAGES = 10;

    private final String baseUrl;
    private final String apiKey;

    protected ApiSportsGateway(String baseUrl, String apiKey) {
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
    }

    /**
     * Path of the schedule endpoint, e.g. "/fixtures".
     */
    protected abstract String scheduleEndpoint();

    /**
     * Path to the event id inside an odds record.
     */
    protected abstract Object[] oddsEventIdPath();

    /**
     * Path to the event id inside a schedule record.
     */
    protected abstract Object[] scheduleEventIdPath();

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank() && !PLACEHOLDER_KEY.equals(apiKey);
    }

    @Override
    public List<JsonNode> fetchEvents(LocalDate date) throws IOException {
        if (!isConfigured()) {
            logger.warn("No API key configured for {}, skipping collection", getSport());
            return List.of();
        }

        List<JsonNode> odds = fetchAllPages("/odds", date);
        if (odds.isEmpty()) {
            logger.info("No {} odds published for {}", getSport(), date);
            return odds;
        }

        Map<String, JsonNode> schedule = new HashMap<>();
        try {
            for (JsonNode fixture : fetchAllPages(scheduleEndpoint(), date)) {
                String id = JsonPathExtractor.text(fixture, null, scheduleEventIdPath());
                if (id != null) {
                    schedule.put(id, fixture);
                }
            }
        } catch (IOException e) {
            logger.warn("Could not load {} schedule for {}, team names will be missing: {}",
                getSport(), date, e.getMessage());
        }

        int enriched = 0;
        for (JsonNode record : odds) {
            String id = JsonPathExtractor.text(record, null, oddsEventIdPath());
            JsonNode fixture = id != null ? schedule.get(id) : null;
            if (fixture != null && record instanceof ObjectNode) {
                fillMissing((ObjectNode) record, fixture);
                enriched++;
            }
        }

        logger.info("Fetched {} {} events for {} ({} matched to the schedule)", odds.size(), getSport(), date, enriched);
        return odds;
    }

    private List<JsonNode> fetchAllPages(String endpoint, LocalDate date) throws IOException {
        List<JsonNode> records = new ArrayList<>();
        int page = 1;
        int totalPages = 1;
        do {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("date", date.toString());
            if (page > 1) {
                params.put("page", String.valueOf(page));
            }

            JsonNode body = HttpClientUtil.getJson(baseUrl + endpoint, params, Map.of(API_KEY_HEADER, apiKey));

            // API-Sports answers 200 with a non-empty "errors" object or array on bad requests
            JsonNode errors = body.get("errors");
            if (errors != null && errors.size() > 0) {
                throw new IOException("API-Sports rejected " + endpoint + " for " + getSport() + ": " + errors);
            }

            JsonNode response = body.get("response");
            if (response != null && response.isArray()) {
                response.forEach(records::add);
            }

            JsonNode total = JsonPathExtractor.find(body, "paging", "total");
            totalPages = total != null && total.canConvertToInt() ? total.asInt() : 1;
            page++;
        } while (page <= totalPages && page <= MAX_PAGES);

        return records;
    }

    static void fillMissing(ObjectNode target, JsonNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!target.has(field.getKey())) {
                target.set(field.getKey(), field.getValue());
            }
        }
    }
}
