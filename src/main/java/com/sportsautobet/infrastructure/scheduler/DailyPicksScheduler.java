package com.sportsautobet.infrastructure.scheduler;

import com.sportsautobet.application.usecase.DailyPicksUseCase;
import com.sportsautobet.infrastructure.sportsdata.ApiSportsGateway;
import com.sportsautobet.infrastructure.telegram.TelegramPicksPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Runs the daily picks cycle on a cron schedule (10:00 by default).
 */
@Component
public class DailyPicksScheduler {

    private static final Logger logger = LoggerFactory.getLogger(DailyPicksScheduler.class);

    private final DailyPicksUseCase dailyPicksUseCase;
    private final List<ApiSportsGateway> apiGateways;
    private final TelegramPicksPublisher telegramPublisher;
    private final ZoneId zone;

    @Value("${autobet.schedule.cron:0 0 10 * * *}")
    private String cron;

    public DailyPicksScheduler(
            DailyPicksUseCase dailyPicksUseCase,
            List<ApiSportsGateway> apiGateways,
            TelegramPicksPublisher telegramPublisher,
            @Value("${autobet.schedule.zone:Europe/Rome}") String zone) {
        this.dailyPicksUseCase = dailyPicksUseCase;
        this.apiGateways = apiGateways;
        this.telegramPublisher = telegramPublisher;
        this.zone = ZoneId.of(zone);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void checkConfiguration() {
        if (apiGateways.stream().noneMatch(ApiSportsGateway::isConfigured)) {
            logger.warn("Sports API key is not configured, no events will be collected");
        }
        if (!telegramPublisher.isConfigured()) {
            logger.warn("Telegram bot token or chat id is not configured, picks will only be logged");
        }
        logger.info("Daily picks scheduled with cron '{}' in zone {}", cron, zone);
    }

    @Scheduled(cron = "${autobet.schedule.cron:0 0 10 * * *}", zone = "${autobet.schedule.zone:Europe/Rome}")
    public void runDaily() {
        LocalDate today = LocalDate.now(zone);
        logger.info("Starting scheduled daily picks run for {}", today);

        try {
            DailyPicksUseCase.DailyRunSummary summary = dailyPicksUseCase.execute(today);
            logger.info("Scheduled run for {} completed: {} picks, events {}, errors {}",
                today, summary.selection().getPicks().size(), summary.eventsBySport(), summary.errors());
        } catch (Exception e) {
            logger.error("Scheduled daily picks run for {} failed, skipping this cycle", today, e);
        }
    }
}
