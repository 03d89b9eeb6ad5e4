package com.sportsautobet.application.usecase;

import com.fasterxml.jackson.databind.JsonNode;
import com.sportsautobet.application.analysis.BestBetsPipeline;
import com.sportsautobet.domain.model.DailyEventData;
import com.sportsautobet.domain.model.DailySelection;
import com.sportsautobet.domain.model.Sport;
import com.sportsautobet.domain.ports.PicksPublisher;
import com.sportsautobet.domain.ports.SelectionRepository;
import com.sportsautobet.domain.ports.SportsDataGateway;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Use case for the daily run: collect events from all gateways in parallel, pick the best bets,
 * publish them and archive them.
 */
@Service
public class DailyPicksUseCase {

    private static final Logger logger = LoggerFactory.getLogger(DailyPicksUseCase.class);

    private final List<SportsDataGateway> gateways;
    private final BestBetsPipeline pipeline;
    private final PicksPublisher publisher;
    private final SelectionRepository selectionRepository;
    private final ExecutorService executorService;

    public DailyPicksUseCase(
            List<SportsDataGateway> gateways,
            BestBetsPipeline pipeline,
            PicksPublisher publisher,
            SelectionRepository selectionRepository) {
        this.gateways = gateways;
        this.pipeline = pipeline;
        this.publisher = publisher;
        this.selectionRepository = selectionRepository;
        this.executorService = Executors.newFixedThreadPool(Math.max(gateways.size(), 4));
    }

    /**
     * Runs the whole daily cycle for a date.
     *
     * @param date Day to collect and analyse
     * @return Summary of the run
     */
    public DailyRunSummary execute(LocalDate date) {
        String day = date.toString();
        logger.info("Starting daily picks run for {} with {} gateways", day, gateways.size());

        Map<String, Integer> eventsBySport = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        DailyEventData data = collect(date, eventsBySport, errors);

        DailySelection selection = analyse(data);

        boolean published = false;
        try {
            published = publisher.publish(selection);
            logger.info("Picks for {} published: {}", day, published);
        } catch (Exception e) {
            logger.error("Error publishing picks for {}", day, e);
            errors.put("publisher", e.getMessage());
        }

        try {
            selectionRepository.save(selection);
        } catch (Exception e) {
            logger.error("Error archiving picks for {}", day, e);
            errors.put("database", e.getMessage());
        }

        return new DailyRunSummary(day, eventsBySport, errors, selection, published);
    }

    /**
     * Scores already collected events without publishing or archiving anything.
     */
    public DailySelection analyse(DailyEventData data) {
        return pipeline.run(data);
    }

    private DailyEventData collect(LocalDate date, Map<String, Integer> eventsBySport, Map<String, String> errors) {
        List<CompletableFuture<GatewayResult>> futures = gateways.stream()
            .map(gateway -> CompletableFuture.supplyAsync(() -> fetch(gateway, date), executorService))
            .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        // Gateway order decides event order when two gateways serve the same sport
        Map<Sport, List<JsonNode>> merged = new EnumMap<>(Sport.class);
        for (CompletableFuture<GatewayResult> future : futures) {
            GatewayResult result = future.join();
            String key = result.sport().getKey();
            if (result.events() != null) {
                merged.computeIfAbsent(result.sport(), s -> new ArrayList<>()).addAll(result.events());
                eventsBySport.merge(key, result.events().size(), Integer::sum);
            } else {
                errors.put(key, result.error());
                eventsBySport.putIfAbsent(key, 0);
            }
        }

        DailyEventData data = new DailyEventData(date.toString());
        merged.forEach(data::put);
        return data;
    }

    private GatewayResult fetch(SportsDataGateway gateway, LocalDate date) {
        Sport sport = gateway.getSport();
        try {
            List<JsonNode> events = gateway.fetchEvents(date);
            List<JsonNode> safeEvents = events != null ? events : List.of();
            logger.info("Gateway {} returned {} events", sport, safeEvents.size());
            return new GatewayResult(sport, safeEvents, null);
        } catch (Exception e) {
            logger.error("Gateway {} failed", sport, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return new GatewayResult(sport, null, message);
        }
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdown();
    }

    private record GatewayResult(Sport sport, List<JsonNode> events, String error) {}

    public record DailyRunSummary(
        String date,
        Map<String, Integer> eventsBySport,
        Map<String, String> errors,
        DailySelection selection,
        boolean published
    ) {}
}
