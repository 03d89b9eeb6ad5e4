package com.sportsautobet.infrastructure.sportsdata;

import com.sportsautobet.domain.model.Sport;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Volleyball odds from API-Sports.
 */
@Component
public class VolleyballGateway extends ApiSportsGateway {

    public VolleyballGateway(
            @Value("${autobet.sports-api.volleyball-url:https://v1.volleyball.api-sports.io}") String baseUrl,
            @Value("${autobet.sports-api.key:" + PLACEHOLDER_KEY + "}") String apiKey) {
        super(baseUrl, apiKey);
    }

    @Override
    public Sport getSport() {
        return Sport.VOLLEYBALL;
    }

    @Override
    protected String scheduleEndpoint() {
        return "/games";
    }

    @Override
    protected Object[] oddsEventIdPath() {
        return new Object[] {"game", "id"};
    }

    @Override
    protected Object[] scheduleEventIdPath() {
        return new Object[] {"id"};
    }
}
