package com.tilemerge.visualizer.simulation;

import com.tilemerge.core.GameState;
import com.tilemerge.core.ai.SearchConstraints;
import com.tilemerge.core.ai.SearchResult;
import com.tilemerge.core.ai.Searcher;
import com.tilemerge.core.driver.LocalGameDriver;
import com.tilemerge.visualizer.model.GameFrame;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import javafx.application.Platform;
import javafx.concurrent.Task;

/**
 * Background task that plays a single game with a {@link Searcher} choosing every move.
 */
public final class SelfPlaySimulationTask extends Task<List<GameFrame>> {

    private final Searcher searcher;
    private final SearchConstraints constraints;
    private final long seed;
    private final int moveCap;
    private final Consumer<GameFrame> frameListener;

    public SelfPlaySimulationTask(Searcher searcher, SearchConstraints constraints, long seed, int moveCap,
            Consumer<GameFrame> frameListener) {
        this.searcher = Objects.requireNonNull(searcher, "searcher");
        this.constraints = Objects.requireNonNull(constraints, "constraints");
        if (moveCap < 1) {
            throw new IllegalArgumentException("Move cap must be at least 1");
        }
        this.seed = seed;
        this.moveCap = moveCap;
        this.frameListener = Objects.requireNonNull(frameListener, "frameListener");
    }

    @Override
    protected List<GameFrame> call() {
        boolean onFxThread;
        try {
            onFxThread = Platform.isFxApplicationThread();
        } catch (IllegalStateException ex) {
            onFxThread = false;
        }
        if (onFxThread) {
            throw new IllegalStateException("Search must not run on the JavaFX application thread");
        }

        updateMessage("Preparing...");
        updateProgress(0, moveCap);

        LocalGameDriver driver = new LocalGameDriver(seed);
        List<GameFrame> frames = new ArrayList<>();
        frames.add(GameFrame.initial(driver.getState()));

        while (!driver.isGameOver() && driver.getState().getMoveNumber() < moveCap) {
            if (isCancelled()) {
                updateMessage("Stopped");
                return frames;
            }

            int moveNumber = driver.getState().getMoveNumber() + 1;
            updateMessage(String.format("Searching move %d", moveNumber));

            SearchResult result = searcher.search(driver.readBoard(), constraints);
            if (result.terminal()) {
                break;
            }
            driver.makeMove(result.direction());

            GameState state = driver.getState();
            GameFrame frame = GameFrame.after(state, result.direction(), result.telemetry());
            frames.add(frame);
            publishFrame(frame);
            updateProgress(state.getMoveNumber(), moveCap);
        }

        updateProgress(moveCap, moveCap);
        GameState last = driver.getState();
        updateMessage(String.format("Finished: score %d, max tile %d", last.getScore(), last.getMaxTile()));
        return frames;
    }

    private void publishFrame(GameFrame frame) {
        Platform.runLater(() -> frameListener.accept(frame));
    }
}
