package com.sportsautobet.application.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.sportsautobet.domain.model.Candidate;
import com.sportsautobet.domain.model.DailyEventData;
import com.sportsautobet.domain.model.OddsPair;
import com.sportsautobet.domain.model.ProbabilityDistribution;
import com.sportsautobet.domain.model.Sport;
import com.sportsautobet.domain.scoring.ImpliedProbabilityEstimator;
import com.sportsautobet.domain.scoring.Rounding;
import com.sportsautobet.domain.scoring.ValueScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns raw provider events into scored candidates, one per event.
 *
 * Per event:
 * 1. Read league, team names, start time and main-bet odds (defaults on any mismatch)
 * 2. Implied probabilities from the odds
 * 3. Blend: 0.6 * implied + 0.3 * form + 0.1 * league prior, per side
 * 4. Value score per side from the blended probability and that side's odds
 * 5. Keep the side with the higher value score, home on ties
 */
public class CandidateBuilder {

    private static final Logger logger = LoggerFactory.getLogger(CandidateBuilder.class);

    public static final double IMPLIED_WEIGHT = 0.6;
    public static final double FORM_WEIGHT = 0.3;
    public static final double LEAGUE_WEIGHT = 0.1;

    private final Map<Sport, SportProfile> profiles;

    public CandidateBuilder() {
        this(SportProfiles.defaults());
    }

    public CandidateBuilder(Map<Sport, SportProfile> profiles) {
        this.profiles = profiles;
    }

    /**
     * Candidates for every profiled sport, in sport declaration order and provider order within
     * a sport. Sports without a profile contribute nothing.
     */
    public List<Candidate> buildAll(DailyEventData data) {
        List<Candidate> candidates = new ArrayList<>();
        for (Sport sport : Sport.values()) {
            List<JsonNode> events = data.eventsFor(sport);
            SportProfile profile = profiles.get(sport);
            if (profile == null) {
                if (!events.isEmpty()) {
                    logger.info("No scoring profile for {}, ignoring {} events", sport, events.size());
                }
                continue;
            }
            for (JsonNode event : events) {
                candidates.add(build(profile, event));
            }
            logger.info("Built {} {} candidates", events.size(), sport);
        }
        return candidates;
    }

    /**
     * Scores one raw event. Always returns a fully populated candidate.
     */
    public Candidate build(SportProfile profile, JsonNode event) {
        String league = RawEventReader.league(event);
        String home = RawEventReader.homeTeam(event);
        String away = RawEventReader.awayTeam(event);
        String startTime = RawEventReader.startTime(event, profile.startTimePath());
        OddsPair odds = RawEventReader.odds(event);

        ProbabilityDistribution implied = ImpliedProbabilityEstimator.estimate(odds);

        double homeLeague = profile.homeLeagueWeight().applyAsDouble(league);
        double awayLeague = 1.0 - homeLeague;

        double homeProbability = blend(implied.home(), profile.form().applyAsDouble(home), homeLeague);
        double awayProbability = blend(implied.away(), profile.form().applyAsDouble(away), awayLeague);

        double homeValue = ValueScorer.score(homeProbability, odds.home());
        double awayValue = ValueScorer.score(awayProbability, odds.away());

        boolean homeSide = homeValue >= awayValue;
        String team = homeSide ? home : away;
        double probability = homeSide ? homeProbability : awayProbability;
        double value = homeSide ? homeValue : awayValue;

        Candidate candidate = new Candidate();
        candidate.setSport(profile.sport());
        candidate.setMarket(profile.market());
        candidate.setPick(homeSide ? profile.homePick() : profile.awayPick());
        candidate.setEventLabel(home + " vs " + away);
        candidate.setLeague(league);
        candidate.setStartTime(startTime);
        candidate.setOdds(homeSide ? odds.home() : odds.away());
        candidate.setProbability(Rounding.round3(probability));
        candidate.setConfidence(Rounding.round3(0.5 * probability + 0.5 * value));
        candidate.setRationale(rationale(team, value));

        logger.debug("{} {}: p={}/{} value={}/{} -> {}",
            profile.sport(), candidate.getEventLabel(),
            homeProbability, awayProbability, homeValue, awayValue, candidate.getPick());
        return candidate;
    }

    static double blend(double implied, double form, double league) {
        return IMPLIED_WEIGHT * implied + FORM_WEIGHT * form + LEAGUE_WEIGHT * league;
    }

    static String rationale(String team, double value) {
        return String.format(Locale.ROOT, "%s favoured by the odds model, value score %.2f", team, value);
    }
}
