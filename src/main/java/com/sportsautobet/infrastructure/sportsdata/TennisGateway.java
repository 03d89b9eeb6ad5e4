package com.sportsautobet.infrastructure.sportsdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.sportsautobet.domain.model.Sport;
import com.sportsautobet.domain.ports.SportsDataGateway;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Tennis is part of the daily input but no provider is wired for it yet.
 */
@Component
public class TennisGateway implements SportsDataGateway {

    @Override
    public Sport getSport() {
        return Sport.TENNIS;
    }

    @Override
    public List<JsonNode> fetchEvents(LocalDate date) {
        return List.of();
    }
}
