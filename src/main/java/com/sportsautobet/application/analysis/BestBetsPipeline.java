package com.sportsautobet.application.analysis;

import com.sportsautobet.domain.model.Candidate;
import com.sportsautobet.domain.model.DailyEventData;
import com.sportsautobet.domain.model.DailySelection;
import com.sportsautobet.domain.scoring.CandidateSelector;
import com.sportsautobet.domain.scoring.ConfidenceAdjuster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Raw daily events in, ranked daily picks out. No I/O and no state between runs.
 */
@Component
public class BestBetsPipeline {

    private static final Logger logger = LoggerFactory.getLogger(BestBetsPipeline.class);

    private final CandidateBuilder candidateBuilder;

    public BestBetsPipeline() {
        this(new CandidateBuilder());
    }

    public BestBetsPipeline(CandidateBuilder candidateBuilder) {
        this.candidateBuilder = candidateBuilder;
    }

    public DailySelection run(DailyEventData data) {
        logger.info("Analysing {} raw events for {}", data.totalEvents(), data.getDate());

        List<Candidate> candidates = candidateBuilder.buildAll(data);
        ConfidenceAdjuster.adjustAll(candidates);
        List<Candidate> picks = CandidateSelector.select(candidates);

        logger.info("Selected {} of {} candidates for {}", picks.size(), candidates.size(), data.getDate());
        return new DailySelection(data.getDate(), picks);
    }
}
