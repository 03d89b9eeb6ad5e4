package com.sportsautobet.domain.ports;

import com.fasterxml.jackson.databind.JsonNode;
import com.sportsautobet.domain.model.Sport;

import java.time.LocalDate;
import java.util.List;

/**
 * Port for collecting the raw events of one sport from a data provider.
 */
public interface SportsDataGateway {

    /**
     * Gets the sport this gateway collects.
     *
     * @return Sport served by this gateway
     */
    Sport getSport();

    /**
     * Fetches the raw event records scheduled on the given date.
     *
     * @param date Day to collect
     * @return Raw events in provider order, possibly empty
     * @throws Exception if the provider cannot be reached or answers with an error
     */
    List<JsonNode> fetchEvents(LocalDate date) throws Exception;
}
