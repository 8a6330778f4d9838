package com.holdco.tycoon;

import com.holdco.tycoon.config.CatalogException;
import com.holdco.tycoon.config.Difficulty;
import com.holdco.tycoon.config.GameDuration;
import com.holdco.tycoon.finance.CovenantHeadroom;
import com.holdco.tycoon.game.GameData;
import com.holdco.tycoon.game.MetricsCalculator;
import com.holdco.tycoon.game.RoundHistoryEntry;
import com.holdco.tycoon.rng.SeedDerivation;
import com.holdco.tycoon.scoring.Grade;
import com.holdco.tycoon.scoring.PostGameInsight;
import com.holdco.tycoon.scoring.ScoreBreakdown;
import com.holdco.tycoon.simulation.GameResult;
import com.holdco.tycoon.simulation.GameRunner;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.util.*;
import java.util.concurrent.Callable;

/**
 * Holdco Tycoon CLI - Main entry point.
 */
@Command(name = "holdco-tycoon",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Holdco capital allocation simulator",
        subcommands = {
                Main.RunCommand.class,
                Main.TraceCommand.class,
                Main.ScoreCommand.class
        })
public class Main implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    /**
     * Options shared by every subcommand that plays games.
     */
    static class GameOptions {
        @Option(names = {"-d", "--difficulty"}, defaultValue = "NORMAL",
                description = "Difficulty: ${COMPLETION-CANDIDATES}")
        Difficulty difficulty;

        @Option(names = {"--quick"}, description = "Play the 10-round quick game")
        boolean quick;

        GameDuration duration() {
            return quick ? GameDuration.QUICK : GameDuration.STANDARD;
        }
    }

    // ========== RUN COMMAND ==========
    @Command(name = "run", description = "Simulate many autopilot games")
    static class RunCommand implements Callable<Integer> {
        @Option(names = {"-n", "--num-games"}, defaultValue = "100",
                description = "Number of games to simulate")
        int numGames;

        @Option(names = {"-s", "--seed"},
                description = "First seed (optional); games use consecutive seeds")
        Integer seed;

        @Mixin
        GameOptions options = new GameOptions();

        @Override
        public Integer call() {
            GameData data = loadData();
            if (data == null) {
                return 1;
            }
            int firstSeed = seed != null ? seed : SeedDerivation.generateRandomSeed();

            System.out.println("\n=== Holdco Tycoon Simulator ===\n");
            System.out.println("Games: " + numGames);
            System.out.println("First seed: " + firstSeed);
            System.out.println("Difficulty: " + options.difficulty + ", " + options.duration().getRounds() + " rounds");
            System.out.println();

            long startTime = System.currentTimeMillis();
            List<GameResult> results = GameRunner.runGames(data, firstSeed, numGames, options.difficulty,
                    options.duration());
            long elapsed = System.currentTimeMillis() - startTime;

            printResults(results, elapsed);
            return 0;
        }
    }

    // ========== TRACE COMMAND ==========
    @Command(name = "trace", description = "Play one autopilot game and print every round")
    static class TraceCommand implements Callable<Integer> {
        @Option(names = {"-s", "--seed"}, required = true, description = "Game seed")
        int seed;

        @Mixin
        GameOptions options = new GameOptions();

        @Override
        public Integer call() {
            GameData data = loadData();
            if (data == null) {
                return 1;
            }
            GameResult result = GameRunner.runGame(data, seed, options.difficulty, options.duration());

            System.out.println("\n=== Game Trace (seed: " + seed + ") ===\n");
            System.out.printf("%-5s %-32s %10s %10s %10s %8s %6s%n",
                    "Year", "Event", "Cash", "EBITDA", "FCF/sh", "ND/E", "Deals");
            for (RoundHistoryEntry entry : result.finalState().getHistory()) {
                System.out.printf("%-5d %-32s %10d %10d %10.2f %8.2f %6d%n",
                        entry.round(),
                        truncate(entry.eventTitle() != null ? entry.eventTitle() : "-", 32),
                        entry.cash(),
                        entry.totalEbitda(),
                        entry.metrics().fcfPerShare(),
                        entry.metrics().netDebtToEbitda(),
                        entry.acquisitions());
            }
            System.out.println();
            printScore(result);
            return 0;
        }
    }

    // ========== SCORE COMMAND ==========
    @Command(name = "score", description = "Play one autopilot game and print its score")
    static class ScoreCommand implements Callable<Integer> {
        @Option(names = {"-s", "--seed"}, required = true, description = "Game seed")
        int seed;

        @Mixin
        GameOptions options = new GameOptions();

        @Override
        public Integer call() {
            GameData data = loadData();
            if (data == null) {
                return 1;
            }
            printScore(GameRunner.runGame(data, seed, options.difficulty, options.duration()));
            return 0;
        }
    }

    // ========== HELPERS ==========

    /**
     * Load the bundled tables, reporting failure on stderr. Returns null on failure.
     */
    private static GameData loadData() {
        try {
            return GameData.loadDefault();
        } catch (CatalogException e) {
            System.err.println("✗ Failed to load game data: " + e.getMessage());
            return null;
        }
    }

    private static void printResults(List<GameResult> results, long elapsedMs) {
        int count = results.size();
        long bankruptcies = results.stream().filter(GameResult::isBankrupt).count();
        double avgScore = results.stream().mapToInt(r -> r.score().total()).average().orElse(0.0);
        double avgEv = results.stream().mapToLong(GameResult::enterpriseValue).average().orElse(0.0);

        Map<Grade, Long> gradeDist = new EnumMap<>(Grade.class);
        for (GameResult r : results) {
            gradeDist.merge(r.grade(), 1L, Long::sum);
        }

        System.out.println("=== Results ===\n");
        System.out.printf("Average score: %.1f%n", avgScore);
        System.out.printf("Average enterprise value: %,.0fk%n", avgEv);
        System.out.printf("Bankruptcy rate: %.1f%% (%d/%d)%n",
                count > 0 ? bankruptcies * 100.0 / count : 0.0, bankruptcies, count);

        System.out.println("\nGrade distribution:");
        for (Grade grade : Grade.values()) {
            long n = gradeDist.getOrDefault(grade, 0L);
            double pct = count > 0 ? n * 100.0 / count : 0.0;
            System.out.printf("  %s: %5.1f%% (%d)%n", grade, pct, n);
        }

        System.out.printf("%nCompleted in %.2fs%n", elapsedMs / 1000.0);
    }

    private static void printScore(GameResult result) {
        ScoreBreakdown score = result.score();
        System.out.println("=== Final Score (seed: " + result.seed() + ") ===\n");
        System.out.printf("FCF/share growth:     %5.1f / 25%n", score.fcfShareGrowth());
        System.out.printf("Portfolio ROIC:       %5.1f / 20%n", score.portfolioRoic());
        System.out.printf("Capital deployment:   %5.1f / 20%n", score.capitalDeployment());
        System.out.printf("Balance sheet health: %5.1f / 15%n", score.balanceSheetHealth());
        System.out.printf("Strategic discipline: %5.1f / 20%n", score.strategicDiscipline());
        System.out.printf("Total:                %5d / %d%n", score.total(), ScoreBreakdown.MAX_TOTAL);
        System.out.println("Grade: " + score.grade() + " - " + score.title());
        System.out.printf("Enterprise value: %,dk%n", result.enterpriseValue());
        if (!result.isBankrupt()) {
            CovenantHeadroom headroom = MetricsCalculator.covenantHeadroom(result.finalState());
            System.out.printf("Leverage: %.2fx (breach at %.1fx), next year's debt service: %,dk%n",
                    headroom.currentLeverage(), headroom.breachThreshold(), headroom.nextYearDebtService());
        }

        if (!result.insights().isEmpty()) {
            System.out.println("\nInsights:");
            for (PostGameInsight insight : result.insights()) {
                System.out.println("  * " + insight.getPattern() + ": " + insight.getInsight());
            }
        }
    }

    private static String truncate(String text, int width) {
        return text.length() <= width ? text : text.substring(0, width - 3) + "...";
    }
}
