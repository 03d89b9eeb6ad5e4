package com.sportsautobet.domain.ports;

import com.sportsautobet.domain.model.DailySelection;

/**
 * Port for archiving daily selections.
 */
public interface SelectionRepository {

    /**
     * Stores the selection, replacing any earlier one for the same date.
     *
     * @param selection Selection to store
     */
    void save(DailySelection selection);

    /**
     * Finds the selection archived for a date.
     *
     * @param date Collection date, YYYY-MM-DD
     * @return The selection if found, null otherwise
     */
    DailySelection findByDate(String date);
}
