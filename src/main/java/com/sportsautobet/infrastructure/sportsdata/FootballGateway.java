package com.sportsautobet.infrastructure.sportsdata;

import com.sportsautobet.domain.model.Sport;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Football odds from API-Sports.
 */
@Component
public class FootballGateway extends ApiSportsGateway {

    public FootballGateway(
            @Value("${autobet.sports-api.football-url:https://v3.football.api-sports.io}") String baseUrl,
            @Value("${autobet.sports-api.key:" + PLACEHOLDER_KEY + "}") String apiKey) {
        super(baseUrl, apiKey);
    }

    @Override
    public Sport getSport() {
        return Sport.FOOTBALL;
    }

    @Override
    protected String scheduleEndpoint() {
        return "/fixtures";
    }

    @Override
    protected Object[] oddsEventIdPath() {
        return new Object[] {"fixture", "id"};
    }

    @Override
    protected Object[] scheduleEventIdPath() {
        return new Object[] {"fixture", "id"};
    }
}
