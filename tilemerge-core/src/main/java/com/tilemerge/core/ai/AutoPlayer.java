package com.tilemerge.core.ai;

import com.tilemerge.core.BoardState;
import com.tilemerge.core.GameState;
import com.tilemerge.core.driver.GameDriver;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Plays complete games against a {@link GameDriver}, asking a {@link Searcher} for every move.
 * Keeps per-game summaries and logs the running statistics after each game.
 */
public final class AutoPlayer {

    private static final Logger LOGGER = Logger.getLogger(AutoPlayer.class.getName());

    private final GameDriver driver;
    private final Searcher searcher;
    private final SearchConstraints constraints;
    private final List<GameSummary> summaries = new ArrayList<>();

    public AutoPlayer(GameDriver driver, Searcher searcher, SearchConstraints constraints) {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.searcher = Objects.requireNonNull(searcher, "searcher");
        this.constraints = Objects.requireNonNull(constraints, "constraints");
    }

    public List<GameSummary> getSummaries() {
        return Collections.unmodifiableList(summaries);
    }

    /**
     * Plays the provided number of games, restarting the driver before each one after the first.
     */
    public List<GameSummary> playGames(int gameCount) {
        if (gameCount < 1) {
            throw new IllegalArgumentException("Game count must be at least 1: " + gameCount);
        }
        List<GameSummary> played = new ArrayList<>(gameCount);
        for (int i = 0; i < gameCount; i++) {
            if (i > 0 || driver.isGameOver()) {
                driver.restart();
            }
            played.add(playGame());
        }
        return played;
    }

    /**
     * Plays the current game until the driver reports that it is over.
     */
    public GameSummary playGame() {
        int moves = 0;
        while (!driver.isGameOver()) {
            BoardState board = driver.readBoard();
            SearchResult result = searcher.search(board, constraints);
            if (result.terminal()) {
                break;
            }
            driver.makeMove(result.direction());
            moves++;
        }

        BoardState finalBoard = driver.readBoard();
        GameSummary summary = new GameSummary(driver.currentScore(), finalBoard.maxTile(), moves,
                finalBoard.maxTile() >= GameState.WINNING_TILE);
        summaries.add(summary);

        int gameNumber = summaries.size();
        double averageScore = summaries.stream().mapToLong(GameSummary::score).average().orElse(0.0);
        long wins = summaries.stream().filter(GameSummary::won).count();
        LOGGER.info(() -> String.format("Completed game %d (score=%d, maxTile=%d, moves=%d, averageScore=%.1f, wins=%d)",
                gameNumber, summary.score(), summary.maxTile(), summary.moves(), averageScore, wins));
        return summary;
    }

    /**
     * Outcome of one finished game.
     */
    public record GameSummary(long score, int maxTile, int moves, boolean won) {
    }
}
