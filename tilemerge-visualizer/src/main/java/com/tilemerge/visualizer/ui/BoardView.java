package com.tilemerge.visualizer.ui;

import com.tilemerge.core.BoardCodec;
import com.tilemerge.core.BoardState;
import com.tilemerge.visualizer.model.GameFrame;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Group;
import javafx.scene.control.Label;
import javafx.scene.layout.Pane;
import javafx.scene.layout.StackPane;
import javafx.scene.paint.Color;
import javafx.scene.paint.Paint;
import javafx.scene.shape.Rectangle;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;

/**
 * Visual representation of the 4x4 playing field.
 */
public final class BoardView extends Pane {

    private static final double TILE_SIZE = 96.0;
    private static final double GAP = 10.0;
    private static final double ARC = 10.0;
    private static final Paint FRAME_FILL = Color.web("#bbada0");
    private static final Paint LAST_MOVE_FILL = Color.web("#8f7a66");

    private final Rectangle[] tiles = new Rectangle[BoardCodec.CELL_COUNT];
    private final Label[] labels = new Label[BoardCodec.CELL_COUNT];
    private final Group boardGroup;
    private final Label lastMoveMarker;
    private final double contentWidth;
    private final double contentHeight;

    public BoardView() {
        setPadding(new Insets(16));
        setStyle("-fx-background-color: linear-gradient(to bottom, #faf8ef, #efe9dc);");
        boardGroup = new Group();
        getChildren().add(boardGroup);

        double side = BoardCodec.SIZE * TILE_SIZE + (BoardCodec.SIZE + 1) * GAP;
        Rectangle frame = new Rectangle(side, side);
        frame.setArcWidth(ARC * 1.5);
        frame.setArcHeight(ARC * 1.5);
        frame.setFill(FRAME_FILL);
        boardGroup.getChildren().add(frame);

        for (int row = 0; row < BoardCodec.SIZE; row++) {
            for (int col = 0; col < BoardCodec.SIZE; col++) {
                int index = row * BoardCodec.SIZE + col;
                Rectangle tile = new Rectangle(TILE_SIZE, TILE_SIZE);
                tile.setArcWidth(ARC);
                tile.setArcHeight(ARC);
                tile.setFill(TilePalette.background(0));
                Label label = new Label();
                label.setMouseTransparent(true);
                StackPane cell = new StackPane(tile, label);
                cell.setAlignment(Pos.CENTER);
                cell.relocate(GAP + col * (TILE_SIZE + GAP), GAP + row * (TILE_SIZE + GAP));
                tiles[index] = tile;
                labels[index] = label;
                boardGroup.getChildren().add(cell);
            }
        }

        lastMoveMarker = new Label();
        lastMoveMarker.setFont(Font.font("System", FontWeight.BOLD, 28));
        lastMoveMarker.setTextFill(LAST_MOVE_FILL);
        lastMoveMarker.relocate(side + GAP * 2, 0);
        lastMoveMarker.setVisible(false);
        boardGroup.getChildren().add(lastMoveMarker);

        contentWidth = side + GAP * 2 + 32;
        contentHeight = side;
        setPrefSize(contentWidth + TILE_SIZE, contentHeight + TILE_SIZE);
        setMinSize(0, 0);
        setMaxSize(Double.MAX_VALUE, Double.MAX_VALUE);
    }

    public void update(GameFrame frame) {
        if (frame == null) {
            for (int index = 0; index < tiles.length; index++) {
                tiles[index].setFill(TilePalette.background(0));
                labels[index].setText("");
            }
            lastMoveMarker.setVisible(false);
            return;
        }

        BoardState board = frame.state().getBoard();
        for (int row = 0; row < BoardCodec.SIZE; row++) {
            for (int col = 0; col < BoardCodec.SIZE; col++) {
                int index = row * BoardCodec.SIZE + col;
                int exponent = board.exponentAt(row, col);
                int value = board.tileAt(row, col);
                tiles[index].setFill(TilePalette.background(exponent));
                Label label = labels[index];
                label.setText(value == 0 ? "" : Integer.toString(value));
                label.setTextFill(TilePalette.text(exponent));
                label.setFont(Font.font("System", FontWeight.BOLD, TilePalette.fontSize(value)));
            }
        }

        if (frame.hasLastMove()) {
            lastMoveMarker.setText(String.valueOf(frame.lastMove().symbol()));
            lastMoveMarker.setVisible(true);
        } else {
            lastMoveMarker.setVisible(false);
        }
    }

    @Override
    protected void layoutChildren() {
        super.layoutChildren();
        var insets = getInsets();
        double availableWidth = getWidth() - insets.getLeft() - insets.getRight();
        double availableHeight = getHeight() - insets.getTop() - insets.getBottom();
        double offsetX = insets.getLeft() + (availableWidth - contentWidth) / 2.0;
        double offsetY = insets.getTop() + (availableHeight - contentHeight) / 2.0;
        boardGroup.relocate(offsetX, offsetY);
    }
}
