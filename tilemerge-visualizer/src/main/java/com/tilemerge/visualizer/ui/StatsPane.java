package com.tilemerge.visualizer.ui;

import com.tilemerge.core.Direction;
import com.tilemerge.core.GameState;
import com.tilemerge.core.ai.SearchTelemetry;
import com.tilemerge.visualizer.model.GameFrame;
import java.util.EnumMap;
import java.util.Map;
import javafx.geometry.Insets;
import javafx.scene.Node;
import javafx.scene.control.Label;
import javafx.scene.layout.GridPane;
import javafx.scene.layout.VBox;

/**
 * Displays the game counters and the search instrumentation of the current frame.
 */
public final class StatsPane extends VBox {

    private static final String NONE = "-";

    private final Label moveValue = valueLabel();
    private final Label scoreValue = valueLabel();
    private final Label maxTileValue = valueLabel();
    private final Label foursValue = valueLabel();
    private final Label lastMoveValue = valueLabel();
    private final Map<Direction, Label> directionValues = new EnumMap<>(Direction.class);
    private final Label movesEvaluatedValue = valueLabel();
    private final Label cacheHitsValue = valueLabel();
    private final Label cacheStoresValue = valueLabel();
    private final Label maxDepthValue = valueLabel();
    private final Label searchTimeValue = valueLabel();

    public StatsPane() {
        setPadding(new Insets(16));
        setSpacing(12);
        setStyle("-fx-background-color: rgba(255,255,255,0.85); -fx-border-color: #d8d0c4; -fx-border-radius: 6; -fx-background-radius: 6;");
        setPrefWidth(308);
        setMinWidth(308);
        setMaxWidth(308);

        Label title = new Label("Statistics");
        title.setStyle("-fx-font-size: 18px; -fx-font-weight: bold;");

        GridPane grid = new GridPane();
        grid.setHgap(10);
        grid.setVgap(8);

        int row = 0;
        addRow(grid, row++, "Move", moveValue);
        addRow(grid, row++, "Score", scoreValue);
        addRow(grid, row++, "Max tile", maxTileValue);
        addRow(grid, row++, "Fours spawned", foursValue);
        addRow(grid, row++, "Last move", lastMoveValue);
        for (Direction direction : Direction.values()) {
            Label value = valueLabel();
            directionValues.put(direction, value);
            addRow(grid, row++, direction.symbol() + " " + direction.name().toLowerCase(), value);
        }
        addRow(grid, row++, "Moves evaluated", movesEvaluatedValue);
        addRow(grid, row++, "Cache hits", cacheHitsValue);
        addRow(grid, row++, "Cache stores", cacheStoresValue);
        addRow(grid, row++, "Max depth", maxDepthValue);
        addRow(grid, row, "Search time", searchTimeValue);

        getChildren().addAll(title, grid);
    }

    public void update(GameFrame frame) {
        if (frame == null) {
            moveValue.setText(NONE);
            scoreValue.setText(NONE);
            maxTileValue.setText(NONE);
            foursValue.setText(NONE);
            lastMoveValue.setText(NONE);
            clearSearchValues();
            return;
        }

        GameState state = frame.state();
        moveValue.setText(String.valueOf(frame.ply()));
        scoreValue.setText(Long.toString(state.getScore()));
        maxTileValue.setText(Integer.toString(state.getMaxTile()));
        foursValue.setText(Integer.toString(state.getFoursSpawned()));
        lastMoveValue.setText(frame.hasLastMove()
                ? frame.lastMove().symbol() + " " + frame.lastMove().name().toLowerCase()
                : NONE);

        if (!frame.hasSearchData()) {
            clearSearchValues();
            return;
        }
        SearchTelemetry telemetry = frame.telemetry();
        for (Map.Entry<Direction, Label> entry : directionValues.entrySet()) {
            SearchTelemetry.DirectionReport report = telemetry.report(entry.getKey());
            if (report == null || report.noOp()) {
                entry.getValue().setText("no-op");
            } else {
                entry.getValue().setText(String.format("%.1f (depth %d)", report.score(), report.depthLimit()));
            }
        }
        movesEvaluatedValue.setText(Long.toString(telemetry.totalMovesEvaluated()));
        cacheHitsValue.setText(Long.toString(telemetry.totalCacheHits()));
        cacheStoresValue.setText(Long.toString(telemetry.totalCacheStores()));
        maxDepthValue.setText(Integer.toString(telemetry.maxDepth()));
        searchTimeValue.setText(String.format("%.1f ms", telemetry.elapsedMillis()));
    }

    private void clearSearchValues() {
        directionValues.values().forEach(label -> label.setText(NONE));
        movesEvaluatedValue.setText(NONE);
        cacheHitsValue.setText(NONE);
        cacheStoresValue.setText(NONE);
        maxDepthValue.setText(NONE);
        searchTimeValue.setText(NONE);
    }

    private static void addRow(GridPane grid, int row, String label, Node value) {
        Label caption = new Label(label + ":");
        caption.setStyle("-fx-text-fill: #4a4f64; -fx-font-weight: 600;");
        grid.addRow(row, caption, value);
    }

    private static Label valueLabel() {
        Label label = new Label(NONE);
        label.setStyle("-fx-font-size: 14px; -fx-text-fill: #1f2333;");
        return label;
    }
}
