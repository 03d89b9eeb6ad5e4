package com.sportsautobet.domain.scoring;

import com.sportsautobet.domain.model.Candidate;
import com.sportsautobet.domain.model.Sport;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the daily top candidates with a soft per-sport cap.
 */
public class CandidateSelector {

    public static final int MAX_PICKS = 3;
    public static final int MAX_PER_SPORT = 2;

    /**
     * Greedy walk over the candidates sorted by descending confidence (stable, so ties keep
     * input order). A candidate is skipped when its sport already holds {@value #MAX_PER_SPORT}
     * picks while the selection is still short of {@value #MAX_PICKS}; the walk ends at
     * {@value #MAX_PICKS} picks or when the input runs out. Candidates are not modified.
     */
    public static List<Candidate> select(List<Candidate> candidates) {
        List<Candidate> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingDouble(Candidate::getConfidence).reversed());

        List<Candidate> result = new ArrayList<>(MAX_PICKS);
        Map<Sport, Integer> perSport = new EnumMap<>(Sport.class);

        for (Candidate candidate : sorted) {
            int count = perSport.getOrDefault(candidate.getSport(), 0);
            // result.size() < MAX_PICKS always holds inside the loop, so the cap is never waived
            if (count >= MAX_PER_SPORT && result.size() < MAX_PICKS) {
                continue;
            }
            result.add(candidate);
            perSport.put(candidate.getSport(), count + 1);
            if (result.size() == MAX_PICKS) {
                break;
            }
        }
        return result;
    }
}
