package com.example.unvoidchess.logic;

import com.example.unvoidchess.exception.GameOverException;
import com.example.unvoidchess.exception.NoPieceException;
import com.example.unvoidchess.exception.WrongColorException;
import com.example.unvoidchess.model.domain.*;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Pure Java class containing the turn, capture and win rules.
 * Holds no state of its own; every call works on the {@link Game} passed in.
 * A call that throws leaves the game untouched.
 */
@Slf4j
public class GameEngine {

    public Game newGame(int width, int height) {
        log.debug("New {}x{} game", width, height);
        return new Game(width, height);
    }

    public void restart(Game game, int width, int height) {
        game.reset(width, height);
        log.debug("Game restarted on a {}x{} board", width, height);
    }

    /**
     * Selects one of the current player's pieces and caches its legal moves.
     * The selection is informational; {@link #attemptMove} still accepts moves
     * for any of the current player's pieces.
     *
     * @return the cached legal moves of the selected piece
     */
    public List<MoveDetail> select(Game game, int r, int c) {
        if (game.isGameOver()) {
            throw new GameOverException("The game is over.");
        }

        Piece piece = game.getBoard().getPiece(r, c).orElseThrow(() -> new NoPieceException(
                "Invalid input: There is no piece at " + CoordinateCodec.format(r, c) + "."));

        if (piece.color() != game.getCurrentPlayer()) {
            throw new WrongColorException("Invalid input: You cannot select a "
                    + piece.color().getDisplayName().toLowerCase() + " piece on "
                    + game.getCurrentPlayer().getDisplayName() + "'s turn.");
        }

        List<MoveDetail> moves = game.getBoard().legalMoves(r, c, piece);
        game.setSelectedSquare(new Point(r, c));
        game.setAvailableMoves(moves);
        log.debug("{} selected {} at {} with {} moves", game.getCurrentPlayer(), piece.type(),
                CoordinateCodec.format(r, c), moves.size());
        return moves;
    }

    public MoveRecord attemptMove(Game game, int fromR, int fromC, int toR, int toC) {
        if (game.isGameOver()) {
            throw new GameOverException("The game is over. Type 'restart' or 'exit'.");
        }

        Board board = game.getBoard();
        PlayerColor mover = game.getCurrentPlayer();
        List<MoveDetail> moves = resolveLegalMoves(game, fromR, fromC);

        // validated by movePiece, so the piece is present from here on
        Piece moving = board.getPiece(fromR, fromC).orElse(null);
        Optional<Piece> captured = board.movePiece(fromR, fromC, toR, toC, mover, moves);

        MoveRecord record = new MoveRecord(mover, moving, new Point(fromR, fromC), new Point(toR, toC),
                captured.orElse(null));
        log.debug("{} moved {} {} -> {}{}", mover, moving.type(), CoordinateCodec.format(fromR, fromC),
                CoordinateCodec.format(toR, toC),
                record.isCapture() ? ", captured " + record.getCaptured().type() : "");

        if (record.isRoyalCaptured()) {
            endGame(game, mover);
        } else {
            game.switchPlayer();
        }
        return record;
    }

    /**
     * Reuses the selection's cached moves when the move starts from the selected
     * square, otherwise computes them afresh so a move is never checked against
     * another piece's destinations.
     */
    private List<MoveDetail> resolveLegalMoves(Game game, int fromR, int fromC) {
        Board board = game.getBoard();
        Optional<Piece> piece = board.getPiece(fromR, fromC);

        if (game.isSelected(fromR, fromC)) {
            if (game.getAvailableMoves() != null) {
                return game.getAvailableMoves();
            }
            return piece.filter(p -> p.color() == game.getCurrentPlayer())
                    .map(p -> board.legalMoves(fromR, fromC, p))
                    .orElse(List.of());
        }

        Piece p = piece.orElseThrow(() -> new NoPieceException(
                "Invalid move: There is no piece at " + CoordinateCodec.format(fromR, fromC) + "."));
        if (p.color() != game.getCurrentPlayer()) {
            throw new WrongColorException("Invalid move: You can't move your opponent's piece.");
        }
        return board.legalMoves(fromR, fromC, p);
    }

    private void endGame(Game game, PlayerColor winner) {
        game.setPhase(GamePhase.GAME_OVER);
        game.setWinner(winner);
        log.debug("Royal captured, {} wins", winner);
    }
}
