package com.example.unvoidchess.model.dto;

import com.example.unvoidchess.model.domain.GamePhase;
import com.example.unvoidchess.model.domain.MoveDetail;
import com.example.unvoidchess.model.domain.Piece;
import com.example.unvoidchess.model.domain.PlayerColor;
import com.example.unvoidchess.model.domain.Point;
import lombok.Data;

import java.util.List;

/**
 * Read-only view of a match handed to the console for rendering.
 */
@Data
public class GameStateDTO {
    private int width;
    private int height;
    private Piece[][] board; // [row][col], null where empty
    private GamePhase phase;
    private PlayerColor currentPlayer;
    private Point selectedSquare;
    private List<MoveDetail> availableMoves;
    private PlayerColor winner;

    public boolean isGameOver() {
        return phase == GamePhase.GAME_OVER;
    }
}
