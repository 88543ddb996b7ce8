package com.tilemerge.visualizer;

import com.tilemerge.core.Direction;
import com.tilemerge.core.GameState;
import com.tilemerge.core.ai.ExpectimaxAI;
import com.tilemerge.core.ai.SearchConstraints;
import com.tilemerge.core.ai.SearchResult;
import com.tilemerge.core.ai.SearchTelemetry;
import com.tilemerge.core.driver.LocalGameDriver;
import com.tilemerge.visualizer.model.GameFrame;
import com.tilemerge.visualizer.simulation.SelfPlaySimulationTask;
import com.tilemerge.visualizer.ui.BoardView;
import com.tilemerge.visualizer.ui.KeyBindings;
import com.tilemerge.visualizer.ui.StatsPane;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import javafx.animation.KeyFrame;
import javafx.animation.Timeline;
import javafx.application.Application;
import javafx.application.Platform;
import javafx.beans.binding.Bindings;
import javafx.beans.property.BooleanProperty;
import javafx.beans.property.IntegerProperty;
import javafx.beans.property.ObjectProperty;
import javafx.beans.property.SimpleBooleanProperty;
import javafx.beans.property.SimpleIntegerProperty;
import javafx.beans.property.SimpleObjectProperty;
import javafx.collections.FXCollections;
import javafx.collections.ObservableList;
import javafx.concurrent.Task;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.control.Button;
import javafx.scene.control.ComboBox;
import javafx.scene.control.Label;
import javafx.scene.control.ProgressBar;
import javafx.scene.control.Spinner;
import javafx.scene.control.SpinnerValueFactory;
import javafx.scene.input.KeyEvent;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.Region;
import javafx.stage.Stage;
import javafx.util.Duration;
import javafx.util.StringConverter;

public final class VisualizerApp extends Application {

    private static final int MAX_SIMULATION_MOVES = 10_000;
    private static final int DEFAULT_SEED = 2048;
    private static final double PLAYBACK_INTERVAL_MILLIS = 120.0;
    private static final Logger LOGGER = Logger.getLogger(VisualizerApp.class.getName());

    private enum ControllerType {
        HUMAN("Human"),
        AI("AI");

        private final String label;

        ControllerType(String label) {
            this.label = label;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    private final ObservableList<GameFrame> frames = FXCollections.observableArrayList();
    private final IntegerProperty currentIndex = new SimpleIntegerProperty(0);
    private final ObjectProperty<GameFrame> currentFrame = new SimpleObjectProperty<>();
    private final BooleanProperty playing = new SimpleBooleanProperty(false);
    private final BooleanProperty simulationRunning = new SimpleBooleanProperty(false);
    private final BooleanProperty gameRunning = new SimpleBooleanProperty(false);
    private final BooleanProperty aiTurnInProgress = new SimpleBooleanProperty(false);

    private Timeline playbackTimeline;
    private ExpectimaxAI ai;
    private SearchConstraints.SearchMode searchMode = SearchConstraints.SearchMode.PAR;
    private BoardView boardView;
    private StatsPane statsPane;
    private Spinner<Integer> seedSpinner;
    private ComboBox<SearchConstraints.SearchMode> searchModeComboBox;
    private ComboBox<ControllerType> controllerComboBox;
    private ProgressBar progressBar;
    private Label statusLabel;
    private LocalGameDriver activeDriver;
    private Task<SearchResult> aiMoveTask;
    private SelfPlaySimulationTask simulationTask;

    public static void main(String[] args) {
        launch(args);
    }

    @Override
    public void start(Stage stage) {
        configureSearchMode(getParameters().getRaw());
        this.ai = new ExpectimaxAI(SearchConstraints.defaults().withMode(searchMode));

        boardView = new BoardView();
        statsPane = new StatsPane();

        setupIndexListener();
        setupPlaybackTimeline();

        currentFrame.addListener((obs, oldFrame, newFrame) -> {
            boardView.update(newFrame);
            statsPane.update(newFrame);
        });

        GameFrame initialFrame = GameFrame.initial(new LocalGameDriver(DEFAULT_SEED).getState());
        frames.setAll(initialFrame);
        currentFrame.set(initialFrame);
        currentIndex.set(0);

        BorderPane root = new BorderPane();
        root.setPadding(new Insets(16));
        root.setCenter(boardView);
        BorderPane.setAlignment(boardView, Pos.CENTER);
        root.setRight(statsPane);
        BorderPane.setMargin(statsPane, new Insets(0, 0, 0, 16));

        HBox controls = buildControls();
        root.setBottom(controls);
        BorderPane.setMargin(controls, new Insets(16, 0, 0, 0));

        Scene scene = new Scene(root, 1200, 800);
        scene.addEventFilter(KeyEvent.KEY_PRESSED, this::handleKeyPressed);
        stage.setTitle("Tilemerge Visualizer");
        stage.setScene(scene);
        stage.setMinWidth(960);
        stage.setMinHeight(720);
        stage.show();
    }

    @Override
    public void stop() {
        if (simulationTask != null) {
            simulationTask.cancel(true);
        }
        if (aiMoveTask != null) {
            aiMoveTask.cancel(true);
        }
        if (ai != null) {
            ai.shutdown();
        }
    }

    private void setupIndexListener() {
        currentIndex.addListener((obs, oldValue, newValue) -> {
            if (frames.isEmpty()) {
                currentFrame.set(null);
                return;
            }
            int requested = newValue.intValue();
            int clamped = Math.max(0, Math.min(requested, frames.size() - 1));
            if (clamped != requested) {
                currentIndex.set(clamped);
                return;
            }
            currentFrame.set(frames.get(clamped));
        });
    }

    private void setupPlaybackTimeline() {
        playbackTimeline = new Timeline(new KeyFrame(Duration.millis(PLAYBACK_INTERVAL_MILLIS),
                event -> advanceFrame()));
        playbackTimeline.setCycleCount(Timeline.INDEFINITE);
    }

    private HBox buildControls() {
        Button simulateButton = new Button("Run simulation");
        simulateButton.setOnAction(event -> runSimulation());

        Button startGameButton = new Button("Start game");
        startGameButton.setOnAction(event -> startGame());

        Button stopGameButton = new Button("Stop game");
        stopGameButton.setOnAction(event -> stopGame());

        Button aiMoveButton = new Button("AI move");
        aiMoveButton.setOnAction(event -> requestSingleAiMove());

        Button previousButton = new Button("⏮");
        previousButton.setOnAction(event -> {
            pausePlayback();
            stepBackward();
        });

        Button nextButton = new Button("⏭");
        nextButton.setOnAction(event -> {
            pausePlayback();
            stepForward();
        });

        Button playButton = new Button("▶");
        playButton.setOnAction(event -> startPlayback());

        Button pauseButton = new Button("⏸");
        pauseButton.setOnAction(event -> pausePlayback());

        Button resetButton = new Button("⏮⏮");
        resetButton.setOnAction(event -> {
            pausePlayback();
            if (!frames.isEmpty()) {
                currentIndex.set(0);
            }
        });

        seedSpinner = new Spinner<>();
        seedSpinner.setValueFactory(new SpinnerValueFactory.IntegerSpinnerValueFactory(0, Integer.MAX_VALUE,
                DEFAULT_SEED));
        seedSpinner.setEditable(true);
        seedSpinner.setPrefWidth(110);

        searchModeComboBox = new ComboBox<>();
        searchModeComboBox.getItems().setAll(SearchConstraints.SearchMode.values());
        searchModeComboBox.setConverter(new StringConverter<>() {
            @Override
            public String toString(SearchConstraints.SearchMode mode) {
                if (mode == null) {
                    return "";
                }
                return switch (mode) {
                    case SEQ -> "Sequential";
                    case PAR -> "Parallel";
                };
            }

            @Override
            public SearchConstraints.SearchMode fromString(String string) {
                if (string == null) {
                    return null;
                }
                return switch (string.toLowerCase(Locale.ROOT)) {
                    case "sequential" -> SearchConstraints.SearchMode.SEQ;
                    case "parallel" -> SearchConstraints.SearchMode.PAR;
                    default -> null;
                };
            }
        });
        searchModeComboBox.setValue(searchMode);
        searchModeComboBox.valueProperty().addListener((obs, oldValue, newValue) -> {
            if (newValue != null) {
                searchMode = newValue;
            }
        });

        controllerComboBox = new ComboBox<>();
        controllerComboBox.getItems().setAll(ControllerType.values());
        controllerComboBox.setValue(ControllerType.HUMAN);

        progressBar = new ProgressBar(0);
        progressBar.setPrefWidth(180);

        statusLabel = new Label("Ready");
        statusLabel.setMinWidth(160);

        Region spacer = new Region();
        HBox.setHgrow(spacer, Priority.ALWAYS);

        HBox navigation = new HBox(8, resetButton, previousButton, nextButton, playButton, pauseButton);
        navigation.setAlignment(Pos.CENTER_LEFT);

        HBox controls = new HBox(12,
                simulateButton,
                startGameButton,
                stopGameButton,
                aiMoveButton,
                new Label("Player:"),
                controllerComboBox,
                new Label("Search mode:"),
                searchModeComboBox,
                new Label("Seed:"),
                seedSpinner,
                navigation,
                spacer,
                progressBar,
                statusLabel);
        controls.setAlignment(Pos.CENTER_LEFT);

        var frameCount = Bindings.size(frames);
        previousButton.disableProperty().bind(Bindings.createBooleanBinding(
                () -> currentIndex.get() <= 0, currentIndex, frameCount));
        nextButton.disableProperty().bind(Bindings.createBooleanBinding(
                () -> frames.isEmpty() || currentIndex.get() >= frames.size() - 1, currentIndex, frameCount));
        resetButton.disableProperty().bind(Bindings.createBooleanBinding(
                () -> frames.isEmpty() || currentIndex.get() == 0, currentIndex, frameCount));
        playButton.disableProperty().bind(playing.or(frameCount.lessThanOrEqualTo(1)).or(simulationRunning)
                .or(gameRunning).or(aiTurnInProgress));
        pauseButton.disableProperty().bind(playing.not());
        simulateButton.disableProperty().bind(simulationRunning.or(gameRunning));
        startGameButton.disableProperty().bind(simulationRunning.or(gameRunning));
        stopGameButton.disableProperty().bind(gameRunning.not());
        aiMoveButton.disableProperty().bind(gameRunning.not().or(aiTurnInProgress));
        seedSpinner.disableProperty().bind(simulationRunning.or(gameRunning));
        controllerComboBox.disableProperty().bind(simulationRunning.or(gameRunning));
        searchModeComboBox.disableProperty().bind(simulationRunning.or(gameRunning));

        return controls;
    }

    private void startPlayback() {
        if (frames.size() <= 1) {
            return;
        }
        playing.set(true);
        playbackTimeline.play();
    }

    private void pausePlayback() {
        playbackTimeline.stop();
        playing.set(false);
    }

    private void stepForward() {
        if (frames.isEmpty()) {
            return;
        }
        currentIndex.set(Math.min(frames.size() - 1, currentIndex.get() + 1));
    }

    private void stepBackward() {
        if (frames.isEmpty()) {
            return;
        }
        currentIndex.set(Math.max(0, currentIndex.get() - 1));
    }

    private void advanceFrame() {
        if (frames.isEmpty()) {
            pausePlayback();
            return;
        }
        int next = currentIndex.get() + 1;
        if (next >= frames.size()) {
            pausePlayback();
            return;
        }
        currentIndex.set(next);
    }

    private SearchConstraints currentConstraints() {
        return SearchConstraints.defaults().withMode(searchMode);
    }

    private void runSimulation() {
        pausePlayback();
        stopGame();

        long seed = normalizeSpinnerValue(seedSpinner);
        SelfPlaySimulationTask task = new SelfPlaySimulationTask(ai, currentConstraints(), seed,
                MAX_SIMULATION_MOVES, frame -> {
            frames.add(frame);
            if (simulationRunning.get()) {
                currentIndex.set(frames.size() - 1);
            }
        });
        GameFrame initialFrame = GameFrame.initial(new LocalGameDriver(seed).getState());
        frames.setAll(initialFrame);
        currentIndex.set(0);
        currentFrame.set(initialFrame);

        simulationRunning.set(true);
        progressBar.progressProperty().bind(task.progressProperty());
        statusLabel.textProperty().bind(task.messageProperty());
        attachSimulationHandlers(task);
        simulationTask = task;

        Thread thread = new Thread(task, "tilemerge-visualizer-simulation");
        thread.setDaemon(true);
        thread.start();
    }

    private void attachSimulationHandlers(SelfPlaySimulationTask task) {
        task.setOnSucceeded(event -> {
            cleanupSimulationBindings();
            List<GameFrame> result = task.getValue();
            frames.setAll(result);
            if (!frames.isEmpty()) {
                int lastIndex = frames.size() - 1;
                currentIndex.set(lastIndex);
                currentFrame.set(frames.get(lastIndex));
            } else {
                currentIndex.set(0);
                currentFrame.set(null);
            }
            progressBar.setProgress(1.0);
            statusLabel.setText(task.getMessage());
        });

        task.setOnFailed(event -> {
            cleanupSimulationBindings();
            Throwable error = task.getException();
            progressBar.setProgress(0);
            statusLabel.setText(error == null ? "Error" : "Error: " + error.getMessage());
            if (error != null) {
                LOGGER.log(Level.SEVERE, "Simulation failed", error);
            }
        });

        task.setOnCancelled(event -> {
            cleanupSimulationBindings();
            progressBar.setProgress(0);
            statusLabel.setText("Cancelled");
        });
    }

    private void cleanupSimulationBindings() {
        simulationRunning.set(false);
        progressBar.progressProperty().unbind();
        statusLabel.textProperty().unbind();
        simulationTask = null;
    }

    private void startGame() {
        pausePlayback();
        stopGame();

        activeDriver = new LocalGameDriver(normalizeSpinnerValue(seedSpinner));
        GameFrame initialFrame = GameFrame.initial(activeDriver.getState());
        frames.setAll(initialFrame);
        currentIndex.set(0);
        currentFrame.set(initialFrame);

        gameRunning.set(true);
        aiTurnInProgress.set(false);
        progressBar.setProgress(0);
        statusLabel.setText("Game started");
        proceedWithCurrentTurn();
    }

    private void stopGame() {
        gameRunning.set(false);
        aiTurnInProgress.set(false);
        if (aiMoveTask != null) {
            aiMoveTask.cancel(true);
            aiMoveTask = null;
        }
        progressBar.progressProperty().unbind();
        statusLabel.textProperty().unbind();
        progressBar.setProgress(0);
        statusLabel.setText("Ready");
    }

    private void proceedWithCurrentTurn() {
        if (!gameRunning.get() || activeDriver == null) {
            return;
        }
        if (activeDriver.isGameOver()) {
            GameState state = activeDriver.getState();
            finishGame(String.format("Game over: score %d, max tile %d", state.getScore(), state.getMaxTile()));
            return;
        }
        if (controllerComboBox.getValue() == ControllerType.AI) {
            runAiTurn();
        } else {
            progressBar.setProgress(0);
            statusLabel.setText("Your move (arrow keys)");
        }
    }

    private void finishGame(String message) {
        gameRunning.set(false);
        aiTurnInProgress.set(false);
        progressBar.setProgress(1.0);
        statusLabel.setText(message);
    }

    private void handleKeyPressed(KeyEvent event) {
        Optional<Direction> direction = KeyBindings.directionFor(event.getCode());
        if (direction.isEmpty()) {
            return;
        }
        if (!gameRunning.get() || aiTurnInProgress.get() || activeDriver == null
                || controllerComboBox.getValue() != ControllerType.HUMAN) {
            return;
        }
        event.consume();
        if (!activeDriver.readBoard().canMove(direction.get())) {
            statusLabel.setText("That move does not change the board");
            return;
        }
        applyMove(direction.get(), SearchTelemetry.empty());
    }

    private void requestSingleAiMove() {
        if (!gameRunning.get() || aiTurnInProgress.get()) {
            return;
        }
        runAiTurn();
    }

    private void runAiTurn() {
        if (!gameRunning.get() || activeDriver == null) {
            return;
        }
        aiTurnInProgress.set(true);
        progressBar.progressProperty().unbind();
        statusLabel.textProperty().unbind();

        int expectedPly = activeDriver.getState().getMoveNumber();
        SearchConstraints constraints = currentConstraints();
        var board = activeDriver.readBoard();

        aiMoveTask = new Task<>() {
            @Override
            protected SearchResult call() {
                updateMessage("AI thinking...");
                updateProgress(-1, 1);
                return ai.search(board, constraints);
            }
        };

        progressBar.progressProperty().bind(aiMoveTask.progressProperty());
        statusLabel.textProperty().bind(aiMoveTask.messageProperty());

        Task<SearchResult> task = aiMoveTask;
        task.setOnSucceeded(event -> {
            cleanupAiTaskBindings();
            SearchResult result = task.getValue();
            Platform.runLater(() -> handleAiResult(expectedPly, result));
        });

        task.setOnFailed(event -> {
            cleanupAiTaskBindings();
            Platform.runLater(() -> handleAiFailure(task.getException()));
        });

        task.setOnCancelled(event -> {
            cleanupAiTaskBindings();
            aiTurnInProgress.set(false);
            Platform.runLater(() -> statusLabel.setText("AI cancelled"));
        });

        Thread thread = new Thread(task, "tilemerge-visualizer-ai-turn");
        thread.setDaemon(true);
        thread.start();
    }

    private void cleanupAiTaskBindings() {
        progressBar.progressProperty().unbind();
        statusLabel.textProperty().unbind();
        progressBar.setProgress(0);
        aiMoveTask = null;
    }

    private void handleAiResult(int expectedPly, SearchResult result) {
        aiTurnInProgress.set(false);
        if (!gameRunning.get() || activeDriver == null) {
            return;
        }
        if (expectedPly != activeDriver.getState().getMoveNumber()) {
            return;
        }
        if (result.terminal()) {
            finishGame("No move changes the board");
            return;
        }
        applyMove(result.direction(), result.telemetry());
    }

    private void handleAiFailure(Throwable error) {
        aiTurnInProgress.set(false);
        if (error != null) {
            LOGGER.log(Level.SEVERE, "AI move failed", error);
        }
        stopGame();
        statusLabel.setText("AI error");
    }

    private void applyMove(Direction direction, SearchTelemetry telemetry) {
        if (activeDriver == null) {
            return;
        }
        activeDriver.makeMove(direction);
        GameFrame frame = GameFrame.after(activeDriver.getState(), direction, telemetry);
        frames.add(frame);
        currentIndex.set(frames.size() - 1);
        currentFrame.set(frame);
        proceedWithCurrentTurn();
    }

    private int normalizeSpinnerValue(Spinner<Integer> spinner) {
        SpinnerValueFactory<Integer> factory = spinner.getValueFactory();
        if (factory != null) {
            try {
                Integer parsed = factory.getConverter().fromString(spinner.getEditor().getText());
                if (parsed != null) {
                    factory.setValue(parsed);
                }
            } catch (NumberFormatException ex) {
                LOGGER.log(Level.FINE, "Keeping previous spinner value", ex);
            }
        }
        Integer value = spinner.getValue();
        return value == null ? 0 : value;
    }

    private void configureSearchMode(List<String> args) {
        if (args == null) {
            return;
        }
        for (String arg : args) {
            if (arg == null) {
                continue;
            }
            String trimmed = arg.trim();
            if (!trimmed.startsWith("--search-mode=")) {
                continue;
            }
            String value = trimmed.substring("--search-mode=".length()).trim();
            if (value.isEmpty()) {
                continue;
            }
            try {
                searchMode = SearchConstraints.SearchMode.valueOf(value.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                LOGGER.log(Level.WARNING, "Unknown search mode: " + value, ex);
            }
            break;
        }
    }
}
