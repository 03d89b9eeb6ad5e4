package com.sportsautobet.infrastructure.telegram;

import com.sportsautobet.domain.model.Candidate;
import com.sportsautobet.domain.model.DailySelection;

import java.util.List;
import java.util.Locale;

/**
 * Renders a daily selection as a plain-text chat message.
 */
public class PicksMessageFormatter {

    public static String format(DailySelection selection) {
        String date = selection.getDate();
        if (!selection.hasPicks()) {
            return String.format(Locale.ROOT, "No recommendation today (%s)", date);
        }

        StringBuilder message = new StringBuilder();
        message.append("Best bets for ").append(date).append('\n');

        List<Candidate> picks = selection.getPicks();
        for (int i = 0; i < picks.size(); i++) {
            message.append(formatLine(i + 1, picks.get(i)));
            if (i < picks.size() - 1) {
                message.append('\n');
            }
        }
        return message.toString();
    }

    /**
     * "1. [FOOTBALL] Inter vs Milan | 1X2 1 @ 1.80 | p=0.63 conf=0.59 | rationale"
     */
    static String formatLine(int position, Candidate candidate) {
        String odds = candidate.getOdds() != null
            ? String.format(Locale.ROOT, "%.2f", candidate.getOdds())
            : "n/a";
        String sport = candidate.getSport() != null ? candidate.getSport().name() : "?";
        return String.format(Locale.ROOT, "%d. [%s] %s | %s %s @ %s | p=%.2f conf=%.2f | %s",
            position,
            sport,
            candidate.getEventLabel(),
            candidate.getMarket(),
            candidate.getPick(),
            odds,
            candidate.getProbability(),
            candidate.getConfidence(),
            candidate.getRationale());
    }
}
