package com.sportsautobet.domain.model;

/**
 * Decimal odds for the two sides of an event. A null side carries no signal.
 */
public record OddsPair(Double home, Double away) {

    public static final OddsPair ABSENT = new OddsPair(null, null);

    /**
     * True when the given odds can be priced: present and strictly above 1.0.
     */
    public static boolean hasSignal(Double odds) {
        return odds != null && odds > 1.0;
    }
}
