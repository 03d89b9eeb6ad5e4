package com.sportsautobet.domain.model;

/**
 * Sports recognized by the daily picks pipeline.
 * Declaration order is the order candidates are built in.
 */
public enum Sport {
    FOOTBALL("football"),
    BASKETBALL("basketball"),
    TENNIS("tennis"),
    VOLLEYBALL("volleyball");

    private final String key;

    Sport(String key) {
        this.key = key;
    }

    /**
     * Key used for this sport in the daily input document.
     */
    public String getKey() {
        return key;
    }

    @Override
    public String toString() {
        return key;
    }
}
