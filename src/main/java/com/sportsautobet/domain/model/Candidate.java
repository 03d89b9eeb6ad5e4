package com.sportsautobet.domain.model;

/**
 * One scored betting recommendation for a single event.
 * Built once per raw event; only the confidence is rewritten afterwards, by the odds-band adjustment.
 */
public class Candidate {

    private Sport sport;

    /** Market label, e.g. "1X2" for football, "ML" for basketball and volleyball. */
    private String market;

    /** Picked side label within the market ("1", "2", "Home", "Away"). */
    private String pick;

    /** "{home} vs {away}". */
    private String eventLabel;

    private String league;

    /** Start timestamp exactly as the provider reported it. May be null. */
    private String startTime;

    /** Decimal odds of the picked side. Null when the provider had none. */
    private Double odds;

    /** Blended probability of the picked side, rounded to 3 decimals. */
    private double probability;

    /** Ranking score in [0,1], rounded to 3 decimals. */
    private double confidence;

    private String rationale;

    public Sport getSport() {
        return sport;
    }

    public void setSport(Sport sport) {
        this.sport = sport;
    }

    public String getMarket() {
        return market;
    }

    public void setMarket(String market) {
        this.market = market;
    }

    public String getPick() {
        return pick;
    }

    public void setPick(String pick) {
        this.pick = pick;
    }

    public String getEventLabel() {
        return eventLabel;
    }

    public void setEventLabel(String eventLabel) {
        this.eventLabel = eventLabel;
    }

    public String getLeague() {
        return league;
    }

    public void setLeague(String league) {
        this.league = league;
    }

    public String getStartTime() {
        return startTime;
    }

    public void setStartTime(String startTime) {
        this.startTime = startTime;
    }

    public Double getOdds() {
        return odds;
    }

    public void setOdds(Double odds) {
        this.odds = odds;
    }

    public double getProbability() {
        return probability;
    }

    public void setProbability(double probability) {
        this.probability = probability;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public String getRationale() {
        return rationale;
    }

    public void setRationale(String rationale) {
        this.rationale = rationale;
    }

    @Override
    public String toString() {
        return sport + " " + eventLabel + " " + market + " " + pick + " conf=" + confidence;
    }
}
