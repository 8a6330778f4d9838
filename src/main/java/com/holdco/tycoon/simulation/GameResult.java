package com.holdco.tycoon.simulation;

import com.holdco.tycoon.game.GameState;
import com.holdco.tycoon.scoring.Grade;
import com.holdco.tycoon.scoring.PostGameInsight;
import com.holdco.tycoon.scoring.ScoreBreakdown;

import java.util.List;

/**
 * Outcome of one simulated game.
 */
public record GameResult(
    int seed,
    GameState finalState,
    ScoreBreakdown score,
    long enterpriseValue,
    List<PostGameInsight> insights
) {
    public GameResult {
        insights = List.copyOf(insights);
    }

    public boolean isBankrupt() {
        return finalState.isBankrupt();
    }

    public Grade grade() {
        return score.grade();
    }

    /**
     * Rounds actually completed.
     */
    public int roundsPlayed() {
        return finalState.getHistory().size();
    }
}
