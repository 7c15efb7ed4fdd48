package com.example.unvoidchess.model.domain;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * State of one match. Mutated by {@link com.example.unvoidchess.logic.GameEngine} only.
 */
@Data
@NoArgsConstructor
public class Game {

    private Board board;
    private PlayerColor currentPlayer;
    private GamePhase phase;

    // Selection made with "select", kept until the turn passes
    private Point selectedSquare;
    private List<MoveDetail> availableMoves;

    private PlayerColor winner; // null while in progress

    public Game(int width, int height) {
        reset(width, height);
    }

    public void reset(int width, int height) {
        this.board = new Board(width, height);
        this.currentPlayer = PlayerColor.FIRST;
        this.phase = GamePhase.IN_PROGRESS;
        this.selectedSquare = null;
        this.availableMoves = null;
        this.winner = null;
    }

    public boolean isGameOver() {
        return phase == GamePhase.GAME_OVER;
    }

    public void switchPlayer() {
        this.currentPlayer = currentPlayer.opponent();
        clearSelection();
    }

    public void clearSelection() {
        this.selectedSquare = null;
        this.availableMoves = null;
    }

    public boolean isSelected(int r, int c) {
        return selectedSquare != null && selectedSquare.r() == r && selectedSquare.c() == c;
    }
}
