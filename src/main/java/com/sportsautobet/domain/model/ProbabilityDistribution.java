package com.sportsautobet.domain.model;

/**
 * Home/away probabilities derived from odds.
 */
public record ProbabilityDistribution(double home, double away) {

    public static final ProbabilityDistribution UNIFORM = new ProbabilityDistribution(0.5, 0.5);
}
