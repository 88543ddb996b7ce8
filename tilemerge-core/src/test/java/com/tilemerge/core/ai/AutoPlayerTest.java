package com.tilemerge.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tilemerge.core.BoardState;
import com.tilemerge.core.Direction;
import com.tilemerge.core.GameState;
import com.tilemerge.core.ai.SearchTelemetry.DirectionReport;
import com.tilemerge.core.driver.LocalGameDriver;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class AutoPlayerTest {

    /** Plays the first direction that changes the board. */
    private static final Searcher FIRST_LEGAL = (state, constraints) -> {
        List<DirectionReport> reports = new ArrayList<>();
        for (Direction direction : Direction.values()) {
            reports.add(state.canMove(direction)
                    ? new DirectionReport(direction, 1.0, false, 1, 0L, 0L, 0L, 0, 0, 0L)
                    : DirectionReport.noOp(direction));
        }
        return SearchResult.select(new SearchTelemetry(reports, 0L));
    };

    @Test
    void playsUntilGameOver() {
        LocalGameDriver driver = new LocalGameDriver(17L);
        AutoPlayer player = new AutoPlayer(driver, FIRST_LEGAL, SearchConstraints.defaults());

        AutoPlayer.GameSummary summary = player.playGame();

        assertTrue(driver.isGameOver());
        assertTrue(summary.moves() > 0);
        assertEquals(driver.currentScore(), summary.score());
        assertEquals(driver.readBoard().maxTile(), summary.maxTile());
        assertEquals(List.of(summary), player.getSummaries());
    }

    @Test
    void restartsBetweenGames() {
        LocalGameDriver driver = new LocalGameDriver(23L);
        AutoPlayer player = new AutoPlayer(driver, FIRST_LEGAL, SearchConstraints.defaults());

        List<AutoPlayer.GameSummary> summaries = player.playGames(3);

        assertEquals(3, summaries.size());
        assertEquals(3, player.getSummaries().size());
        assertTrue(summaries.stream().allMatch(summary -> summary.moves() > 0));
    }

    @Test
    void stopsAtWinningTileWhenNotKeepingPlaying() {
        GameState nearWin = GameState.of(BoardState.fromValues(new int[][] {
                {1024, 1024, 2, 4},
                {2, 4, 8, 16},
                {4, 8, 16, 32},
                {8, 16, 32, 64}}));
        LocalGameDriver driver = new LocalGameDriver(new Random(1L), nearWin);
        driver.setKeepPlaying(false);
        Searcher searcher = new ExpectimaxAI();
        SearchConstraints constraints = SearchConstraints.defaults().withMode(SearchConstraints.SearchMode.SEQ);

        AutoPlayer.GameSummary summary = new AutoPlayer(driver, searcher, constraints).playGame();

        assertTrue(summary.won());
        assertEquals(1, summary.moves());
        assertEquals(GameState.WINNING_TILE, summary.maxTile());
    }

    @Test
    void rejectsNonPositiveGameCount() {
        AutoPlayer player = new AutoPlayer(new LocalGameDriver(1L), FIRST_LEGAL, SearchConstraints.defaults());

        assertThrows(IllegalArgumentException.class, () -> player.playGames(0));
    }
}
