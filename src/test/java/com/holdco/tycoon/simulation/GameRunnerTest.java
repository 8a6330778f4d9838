package com.holdco.tycoon.simulation;

import com.holdco.tycoon.config.Difficulty;
import com.holdco.tycoon.config.GameDuration;
import com.holdco.tycoon.game.GameData;
import com.holdco.tycoon.scoring.ScoreBreakdown;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GameRunnerTest {

    private static GameData data;

    @BeforeAll
    static void loadData() throws Exception {
        data = GameData.loadDefault();
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 7, 42, 1000, 31337, 271828})
    void testGamesFinish(int seed) {
        GameResult result = GameRunner.runGame(data, seed, Difficulty.NORMAL, GameDuration.STANDARD);

        assertTrue(result.finalState().isGameOver());
        assertTrue(result.roundsPlayed() <= 20);
        assertTrue(result.roundsPlayed() >= 1);
        assertTrue(result.enterpriseValue() >= 0);
        assertTrue(result.finalState().getCash() >= 0);
        assertTrue(result.insights().size() <= 3);
        ScoreBreakdown score = result.score();
        assertTrue(score.total() >= 0 && score.total() <= ScoreBreakdown.MAX_TOTAL);
        if (result.isBankrupt()) {
            assertEquals(0, score.total());
        } else {
            assertEquals(20, result.roundsPlayed());
        }
    }

    @Test
    void testSameSeedSameGame() {
        GameResult a = GameRunner.runGame(data, 2024, Difficulty.NORMAL, GameDuration.QUICK);
        GameResult b = GameRunner.runGame(data, 2024, Difficulty.NORMAL, GameDuration.QUICK);

        assertEquals(a.score(), b.score());
        assertEquals(a.enterpriseValue(), b.enterpriseValue());
        assertEquals(a.finalState().getCash(), b.finalState().getCash());
        assertEquals(a.roundsPlayed(), b.roundsPlayed());
        for (int i = 0; i < a.roundsPlayed(); i++) {
            assertEquals(a.finalState().getHistory().get(i).eventType(),
                b.finalState().getHistory().get(i).eventType(), "Round " + (i + 1));
            assertEquals(a.finalState().getHistory().get(i).cash(), b.finalState().getHistory().get(i).cash());
        }
    }

    @Test
    void testParallelRunMatchesSequential() {
        List<GameResult> batch = GameRunner.runGames(data, 500, 4, Difficulty.EASY, GameDuration.QUICK);

        assertEquals(4, batch.size());
        for (int i = 0; i < batch.size(); i++) {
            GameResult single = GameRunner.runGame(data, 500 + i, Difficulty.EASY, GameDuration.QUICK);
            assertEquals(500 + i, batch.get(i).seed());
            assertEquals(single.score(), batch.get(i).score());
            assertEquals(single.enterpriseValue(), batch.get(i).enterpriseValue());
        }
    }

    @Test
    void testAutopilotAcquires() {
        GameResult result = GameRunner.runGame(data, 42, Difficulty.EASY, GameDuration.QUICK);
        assertTrue(result.finalState().getBusinesses().size() > 1, "Twenty million in cash should buy something");
    }
}
