package com.sportsautobet.infrastructure.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.sportsautobet.application.usecase.DailyPicksUseCase;
import com.sportsautobet.domain.model.DailyEventData;
import com.sportsautobet.domain.model.DailySelection;
import com.sportsautobet.domain.ports.SelectionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.ZoneId;

/**
 * REST controller for daily picks.
 */
@RestController
@RequestMapping("/picks")
public class PicksController {

    private static final Logger logger = LoggerFactory.getLogger(PicksController.class);

    private final DailyPicksUseCase dailyPicksUseCase;
    private final SelectionRepository selectionRepository;
    private final ZoneId zone;

    public PicksController(
            DailyPicksUseCase dailyPicksUseCase,
            SelectionRepository selectionRepository,
            @Value("${autobet.schedule.zone:Europe/Rome}") String zone) {
        this.dailyPicksUseCase = dailyPicksUseCase;
        this.selectionRepository = selectionRepository;
        this.zone = ZoneId.of(zone);
    }

    /**
     * Runs the full daily cycle now.
     *
     * POST /picks/run?date=2025-05-04 (date defaults to today)
     */
    @PostMapping("/run")
    public ResponseEntity<DailyPicksUseCase.DailyRunSummary> run(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate day = date != null ? date : LocalDate.now(zone);
        logger.info("Received request to run daily picks for {}", day);

        try {
            DailyPicksUseCase.DailyRunSummary summary = dailyPicksUseCase.execute(day);
            logger.info("Daily picks run for {} completed with {} picks", day, summary.selection().getPicks().size());
            return ResponseEntity.ok(summary);
        } catch (Exception e) {
            logger.error("Error running daily picks for {}", day, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * Scores a posted daily input document without publishing it.
     *
     * POST /picks/analyze with {"data_raccolta": "...", "football": [...], ...}
     */
    @PostMapping("/analyze")
    public ResponseEntity<DailySelection> analyze(@RequestBody JsonNode input) {
        try {
            return ResponseEntity.ok(dailyPicksUseCase.analyse(DailyEventData.fromJson(input)));
        } catch (Exception e) {
            logger.error("Error analysing posted events", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * GET /picks/2025-05-04
     */
    @GetMapping("/{date}")
    public ResponseEntity<DailySelection> byDate(@PathVariable String date) {
        DailySelection selection = selectionRepository.findByDate(date);
        return selection != null ? ResponseEntity.ok(selection) : ResponseEntity.notFound().build();
    }
}
