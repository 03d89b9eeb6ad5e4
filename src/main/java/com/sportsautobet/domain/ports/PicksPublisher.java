package com.sportsautobet.domain.ports;

import com.sportsautobet.domain.model.DailySelection;

/**
 * Port for delivering the daily picks to their audience.
 */
public interface PicksPublisher {

    /**
     * Publishes the selection, including the empty one.
     *
     * @param selection Picks for the day
     * @return true if the message was delivered, false if delivery is disabled
     * @throws Exception if delivery was attempted and failed
     */
    boolean publish(DailySelection selection) throws Exception;
}
