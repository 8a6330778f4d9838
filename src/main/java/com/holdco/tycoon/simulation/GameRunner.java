package com.holdco.tycoon.simulation;

import com.holdco.tycoon.config.Difficulty;
import com.holdco.tycoon.config.GameDuration;
import com.holdco.tycoon.game.GameData;
import com.holdco.tycoon.game.GameState;
import com.holdco.tycoon.game.RoundManager;
import com.holdco.tycoon.scoring.ScoreCalculator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Plays whole games with the {@link AutoPilot} and scores them.
 */
public final class GameRunner {
    private static final Logger logger = LoggerFactory.getLogger(GameRunner.class);

    private GameRunner() {
        // Utility class - prevent instantiation
    }

    /**
     * Play one game from start to finish.
     *
     * @throws IllegalStateException if a step leaves the game unchanged, which would loop forever
     */
    public static GameResult runGame(GameData data, int seed, Difficulty difficulty, GameDuration duration) {
        GameState state = RoundManager.startGame(data, seed, difficulty, duration);
        while (!state.isGameOver()) {
            GameState next = step(state);
            if (next == state) {
                throw new IllegalStateException("No progress in round " + state.getRound()
                    + " phase " + state.getPhase() + " (seed " + seed + ")");
            }
            state = next;
        }
        GameResult result = new GameResult(seed, state, ScoreCalculator.calculateFinalScore(state),
            ScoreCalculator.enterpriseValue(state), ScoreCalculator.generatePostGameInsights(state));
        logger.debug("Seed {} finished: grade {} ({}), EV {}", seed, result.grade(), result.score().total(),
            result.enterpriseValue());
        return result;
    }

    /**
     * Games for seeds {@code firstSeed .. firstSeed + count - 1}. Games share nothing but the static
     * data, so they run in parallel; results come back in seed order.
     */
    public static List<GameResult> runGames(GameData data, int firstSeed, int count, Difficulty difficulty,
                                            GameDuration duration) {
        return IntStream.range(0, count)
            .parallel()
            .mapToObj(i -> runGame(data, firstSeed + i, difficulty, duration))
            .toList();
    }

    /**
     * One phase transition, with the autopilot's decisions made first where the phase calls for them.
     */
    static GameState step(GameState state) {
        switch (state.getPhase()) {
            case COLLECT:
                return RoundManager.advanceToEvent(state);
            case EVENT:
                return RoundManager.advanceToAllocate(AutoPilot.resolveChoice(state));
            case ALLOCATE:
                return RoundManager.endRound(AutoPilot.allocate(state));
            case RESTRUCTURE: {
                GameState restructured = AutoPilot.restructure(state);
                return restructured.isGameOver() ? restructured : RoundManager.advanceFromRestructure(restructured);
            }
            default:
                throw new IllegalStateException("Unknown phase " + state.getPhase());
        }
    }
}
