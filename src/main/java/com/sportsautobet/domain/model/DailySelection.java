package com.sportsautobet.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Final ranked picks for one collection date, highest confidence first.
 */
public class DailySelection {

    /** Collection date, YYYY-MM-DD, passed through from the input. */
    private String date;

    private List<Candidate> picks = new ArrayList<>();

    public DailySelection() {
    }

    public DailySelection(String date, List<Candidate> picks) {
        this.date = date;
        this.picks = picks;
    }

    public String getDate() {
        return date;
    }

    public void setDate(String date) {
        this.date = date;
    }

    public List<Candidate> getPicks() {
        return picks;
    }

    public void setPicks(List<Candidate> picks) {
        this.picks = picks;
    }

    public boolean hasPicks() {
        return picks != null && !picks.isEmpty();
    }
}
