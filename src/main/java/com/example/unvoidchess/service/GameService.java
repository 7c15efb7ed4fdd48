package com.example.unvoidchess.service;

import com.example.unvoidchess.logic.CoordinateCodec;
import com.example.unvoidchess.logic.GameEngine;
import com.example.unvoidchess.model.domain.Game;
import com.example.unvoidchess.model.domain.MoveDetail;
import com.example.unvoidchess.model.domain.MoveRecord;
import com.example.unvoidchess.model.domain.Point;
import com.example.unvoidchess.model.dto.GameStateDTO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Owns the single running match and translates square labels for the engine.
 * Not thread-safe; the console loop is its only caller.
 */
@Slf4j
@Service
public class GameService {

    private final GameEngine gameEngine;
    private Game game;

    public GameService() {
        this(new GameEngine());
    }

    GameService(GameEngine gameEngine) {
        this.gameEngine = gameEngine;
    }

    public Game startMatch(int width, int height) {
        this.game = gameEngine.newGame(width, height);
        log.info("Match started on a {}x{} board", width, height);
        return game;
    }

    public void restart() {
        Game current = requireGame();
        gameEngine.restart(current, current.getBoard().getWidth(), current.getBoard().getHeight());
        log.info("Match restarted");
    }

    public Point parseSquare(String label) {
        Game current = requireGame();
        return CoordinateCodec.parse(label, current.getBoard().getHeight(), current.getBoard().getWidth());
    }

    public List<MoveDetail> select(Point square) {
        return gameEngine.select(requireGame(), square.r(), square.c());
    }

    public MoveRecord move(Point from, Point to) {
        Game current = requireGame();
        MoveRecord record = gameEngine.attemptMove(current, from.r(), from.c(), to.r(), to.c());
        if (record.isCapture()) {
            log.info("{} captured {} with {} -> {}", record.getPlayer(), record.getCaptured().type(),
                    CoordinateCodec.format(record.getFrom()), CoordinateCodec.format(record.getTo()));
        }
        if (current.isGameOver()) {
            log.info("Game over, winner: {}", current.getWinner());
        }
        return record;
    }

    public Game getGame() {
        return game;
    }

    public GameStateDTO snapshot() {
        return mapToDTO(requireGame());
    }

    private GameStateDTO mapToDTO(Game game) {
        GameStateDTO dto = new GameStateDTO();
        dto.setWidth(game.getBoard().getWidth());
        dto.setHeight(game.getBoard().getHeight());
        dto.setBoard(game.getBoard().view());
        dto.setPhase(game.getPhase());
        dto.setCurrentPlayer(game.getCurrentPlayer());
        dto.setSelectedSquare(game.getSelectedSquare());
        dto.setAvailableMoves(game.getAvailableMoves() == null ? null : List.copyOf(game.getAvailableMoves()));
        dto.setWinner(game.getWinner());
        return dto;
    }

    private Game requireGame() {
        if (game == null) {
            throw new IllegalStateException("No match in progress");
        }
        return game;
    }
}
