package com.tilemerge.core;

import com.tilemerge.core.ai.ExpectimaxAI;
import com.tilemerge.core.ai.SearchConstraints;
import com.tilemerge.core.ai.SearchResult;
import java.util.Random;
import java.util.Scanner;

/**
 * Simple console front-end for playing a game by hand, with engine hints on request.
 */
public final class TilemergeCLI {

    private TilemergeCLI() {
    }

    public static void main(String[] args) {
        Scanner scanner = new Scanner(System.in);
        Random random = new Random();
        GameState state = GameState.newGame(random);
        ExpectimaxAI ai = new ExpectimaxAI(SearchConstraints.defaults().withMode(SearchConstraints.SearchMode.SEQ));

        System.out.println("Tilemerge - console edition");
        System.out.println("Moves: w/a/s/d or up/down/left/right, h for a hint, q to quit");
        while (!state.isGameOver()) {
            System.out.println(state);
            System.out.print("> ");
            if (!scanner.hasNextLine()) {
                break;
            }
            String input = scanner.nextLine().trim();
            if (input.isEmpty()) {
                continue;
            }
            if ("q".equalsIgnoreCase(input)) {
                break;
            }
            if ("h".equalsIgnoreCase(input)) {
                SearchResult hint = ai.search(state.getBoard(), ai.getConstraints());
                System.out.printf("Hint: %s %c (expected score %.0f)%n", hint.direction(), hint.direction().symbol(),
                        hint.score());
                continue;
            }

            Direction direction;
            try {
                direction = parseMove(input);
            } catch (IllegalArgumentException ex) {
                System.out.println(ex.getMessage());
                continue;
            }
            if (!state.getBoard().canMove(direction)) {
                System.out.println("That move does not change the board.");
                continue;
            }
            boolean wonBefore = state.hasWon();
            state = state.applyMove(direction).spawnTile(random);
            if (!wonBefore && state.hasWon()) {
                System.out.printf("You reached %d!%n", GameState.WINNING_TILE);
            }
        }

        System.out.println(state);
        System.out.printf("Final score: %d, max tile: %d%n", state.getScore(), state.getMaxTile());
    }

    /**
     * Accepts a single w/a/s/d key or a full direction name.
     */
    static Direction parseMove(String input) {
        String trimmed = input.trim();
        if (trimmed.length() == 1) {
            return Direction.fromKey(trimmed.charAt(0));
        }
        return Direction.parse(trimmed);
    }
}
