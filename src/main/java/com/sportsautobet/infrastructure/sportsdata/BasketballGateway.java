package com.sportsautobet.infrastructure.sportsdata;

import com.sportsautobet.domain.model.Sport;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Basketball odds from API-Sports.
 */
@Component
public class BasketballGateway extends ApiSportsGateway {

    public BasketballGateway(
            @Value("${autobet.sports-api.basketball-url:https://v1.basketball.api-sports.io}") String baseUrl,
            @Value("${autobet.sports-api.key:" + PLACEHOLDER_KEY + "}") String apiKey) {
        super(baseUrl, apiKey);
    }

    @Override
    public Sport getSport() {
        return Sport.BASKETBALL;
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
