package com.sportsautobet.application.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.sportsautobet.domain.model.OddsPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Field accessors for API-Sports odds records.
 *
 * The odds path assumes the provider lists the preferred bookmaker first, the match-winner bet
 * first within it, and home before away in its values. Every accessor falls back to a default
 * when the record does not match that layout.
 */
public class RawEventReader {

    private static final Logger logger = LoggerFactory.getLogger(RawEventReader.class);

    public static final String DEFAULT_HOME = "Home";
    public static final String DEFAULT_AWAY = "Away";
    public static final String DEFAULT_LEAGUE = "";

    /** bookmakers[0].bets[0].values */
    static final Object[] MAIN_BET_VALUES = {"bookmakers", 0, "bets", 0, "values"};

    public static String league(JsonNode event) {
        return JsonPathExtractor.text(event, DEFAULT_LEAGUE, "league", "name");
    }

    public static String homeTeam(JsonNode event) {
        return JsonPathExtractor.text(event, DEFAULT_HOME, "teams", "home", "name");
    }

    public static String awayTeam(JsonNode event) {
        return JsonPathExtractor.text(event, DEFAULT_AWAY, "teams", "away", "name");
    }

    public static String startTime(JsonNode event, List<Object> path) {
        return JsonPathExtractor.text(event, null, path.toArray());
    }

    /**
     * Home and away decimal odds from the main bet. A side that is missing stays null;
     * a side that is present but not a finite number voids both sides.
     */
    public static OddsPair odds(JsonNode event) {
        JsonNode values = JsonPathExtractor.find(event, MAIN_BET_VALUES);
        JsonNode home = JsonPathExtractor.find(values, 0, "odd");
        JsonNode away = JsonPathExtractor.find(values, 1, "odd");
        try {
            return new OddsPair(toDecimal(home), toDecimal(away));
        } catch (NumberFormatException e) {
            logger.debug("Discarding unreadable odds home={} away={}: {}", home, away, e.getMessage());
            return OddsPair.ABSENT;
        }
    }

    static Double toDecimal(JsonNode node) {
        if (node == null) {
            return null;
        }
        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            value = Double.parseDouble(node.asText().trim());
        } else {
            throw new NumberFormatException("Not a number: " + node.getNodeType());
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new NumberFormatException("Not a finite number: " + node.asText());
        }
        return value;
    }
}
