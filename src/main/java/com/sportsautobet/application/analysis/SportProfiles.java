package com.sportsautobet.application.analysis;

import com.sportsautobet.domain.model.Sport;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scoring profiles for the sports that produce candidates.
 * Tennis has no profile: its source is recognized but currently delivers no events.
 */
public class SportProfiles {

    public static final String FOOTBALL_MARKET = "1X2";
    public static final String MONEYLINE_MARKET = "ML";

    /** League names containing one of these get a home-side league prior of {@value #TOP_TIER_HOME_WEIGHT}. */
    public static final List<String> TOP_TIER_MARKERS = List.of("Serie", "Premier");
    public static final double TOP_TIER_HOME_WEIGHT = 0.55;
    public static final double NEUTRAL_WEIGHT = 0.5;

    /**
     * Placeholder form prior: no per-team history is collected yet, every team sits at 0.5.
     */
    public static double neutralForm(String team) {
        return NEUTRAL_WEIGHT;
    }

    /**
     * Home-side league prior for football. Marker matching is a case-sensitive substring test.
     */
    public static double footballLeagueWeight(String league) {
        if (league != null) {
            for (String marker : TOP_TIER_MARKERS) {
                if (league.contains(marker)) {
                    return TOP_TIER_HOME_WEIGHT;
                }
            }
        }
        return NEUTRAL_WEIGHT;
    }

    public static double flatLeagueWeight(String league) {
        return NEUTRAL_WEIGHT;
    }

    public static final SportProfile FOOTBALL = new SportProfile(
        Sport.FOOTBALL,
        FOOTBALL_MARKET,
        "1",
        "2",
        List.of("fixture", "date"),
        SportProfiles::footballLeagueWeight,
        SportProfiles::neutralForm
    );

    public static final SportProfile BASKETBALL = moneyline(Sport.BASKETBALL);

    public static final SportProfile VOLLEYBALL = moneyline(Sport.VOLLEYBALL);

    private static SportProfile moneyline(Sport sport) {
        return new SportProfile(
            sport,
            MONEYLINE_MARKET,
            "Home",
            "Away",
            List.of("date"),
            SportProfiles::flatLeagueWeight,
            SportProfiles::neutralForm
        );
    }

    public static Map<Sport, SportProfile> defaults() {
        Map<Sport, SportProfile> profiles = new EnumMap<>(Sport.class);
        profiles.put(Sport.FOOTBALL, FOOTBALL);
        profiles.put(Sport.BASKETBALL, BASKETBALL);
        profiles.put(Sport.VOLLEYBALL, VOLLEYBALL);
        return Collections.unmodifiableMap(profiles);
    }
}
