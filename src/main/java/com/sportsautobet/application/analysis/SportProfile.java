package com.sportsautobet.application.analysis;

import com.sportsautobet.domain.model.Sport;

import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Everything that differs between sports when turning a raw event into a candidate.
 *
 * @param sport             sport this profile scores
 * @param market            market label put on the candidate
 * @param homePick          pick label when the home side is chosen
 * @param awayPick          pick label when the away side is chosen
 * @param startTimePath     path to the start timestamp inside the raw event
 * @param homeLeagueWeight  league prior for the home side, from the league name; away gets 1 - this
 * @param form              recent-form prior for a team, from its name
 */
public record SportProfile(
    Sport sport,
    String market,
    String homePick,
    String awayPick,
    List<Object> startTimePath,
    ToDoubleFunction<String> homeLeagueWeight,
    ToDoubleFunction<String> form
) {}
