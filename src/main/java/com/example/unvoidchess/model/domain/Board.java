package com.example.unvoidchess.model.domain;

import com.example.unvoidchess.exception.IllegalDestinationException;
import com.example.unvoidchess.exception.NoPieceException;
import com.example.unvoidchess.exception.SameSquareException;
import com.example.unvoidchess.exception.WrongColorException;
import com.example.unvoidchess.logic.CoordinateCodec;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rectangular grid of squares, row 0 at the bottom (FIRST's home row).
 * Owns every piece on it and is only mutated through {@link #movePiece}.
 */
public class Board {

    private static final int[][] DIRECTIONS = {
            {-1, -1}, {-1, 0}, {-1, 1},
            {0, -1}, {0, 1},
            {1, -1}, {1, 0}, {1, 1}
    };

    private static final int[][] L_SHAPES = {
            {1, 2}, {1, -2}, {-1, 2}, {-1, -2},
            {2, 1}, {2, -1}, {-2, 1}, {-2, -1}
    };

    private static final int RUNNER_MAX_DISTANCE = 3;

    @Getter
    private final int width;
    @Getter
    private final int height;
    private final Square[][] grid;

    /**
     * Dimensions are expected to be validated by the caller.
     */
    public Board(int width, int height) {
        this.width = width;
        this.height = height;
        this.grid = new Square[height][width];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                grid[r][c] = new Square();
            }
        }
        setupPieces();
    }

    private void setupPieces() {
        if (width >= 1) grid[0][0].setPiece(new Piece(PieceType.ROYAL, PlayerColor.FIRST));
        if (width >= 2) grid[0][1].setPiece(new Piece(PieceType.RUNNER, PlayerColor.FIRST));
        if (width >= 3) grid[0][2].setPiece(new Piece(PieceType.LEAPER, PlayerColor.FIRST));

        // SECOND mirrors FIRST from the opposite corner
        int top = height - 1;
        if (width >= 1) grid[top][width - 1].setPiece(new Piece(PieceType.ROYAL, PlayerColor.SECOND));
        if (width >= 2) grid[top][width - 2].setPiece(new Piece(PieceType.RUNNER, PlayerColor.SECOND));
        if (width >= 3) grid[top][width - 3].setPiece(new Piece(PieceType.LEAPER, PlayerColor.SECOND));
    }

    public boolean inBounds(int r, int c) {
        return r >= 0 && r < height && c >= 0 && c < width;
    }

    public Optional<Piece> getPiece(int r, int c) {
        if (!inBounds(r, c)) {
            return Optional.empty();
        }
        return Optional.ofNullable(grid[r][c].getPiece());
    }

    /** Places or clears a piece directly, bypassing move rules. Used to set up positions. */
    void setPiece(int r, int c, Piece piece) {
        grid[r][c].setPiece(piece);
    }

    /**
     * Computes every destination reachable by {@code piece} standing on (r, c).
     * Does not modify the board.
     */
    public List<MoveDetail> legalMoves(int r, int c, Piece piece) {
        return switch (piece.type()) {
            case ROYAL -> landingMoves(r, c, piece, DIRECTIONS);
            case LEAPER -> landingMoves(r, c, piece, L_SHAPES);
            case RUNNER -> runnerMoves(r, c, piece);
        };
    }

    private List<MoveDetail> landingMoves(int r, int c, Piece piece, int[][] offsets) {
        List<MoveDetail> moves = new ArrayList<>();
        for (int[] d : offsets) {
            int toR = r + d[0];
            int toC = c + d[1];
            if (!inBounds(toR, toC)) {
                continue;
            }
            Piece target = grid[toR][toC].getPiece();
            if (target == null) {
                moves.add(MoveDetail.plain(toR, toC));
            } else if (piece.isOpponentOf(target)) {
                moves.add(MoveDetail.landing(toR, toC));
            }
        }
        return moves;
    }

    private List<MoveDetail> runnerMoves(int r, int c, Piece piece) {
        List<MoveDetail> moves = new ArrayList<>();
        for (int[] d : DIRECTIONS) {
            for (int dist = 1; dist <= RUNNER_MAX_DISTANCE; dist++) {
                int toR = r + d[0] * dist;
                int toC = c + d[1] * dist;

                if (!inBounds(toR, toC)) {
                    break;
                }
                // a Runner only ever lands on an empty square, but may pass over an occupied one
                if (!grid[toR][toC].isEmpty()) {
                    continue;
                }

                Point jumped = null;
                boolean blocked = false;
                for (int step = 1; step < dist; step++) {
                    int pathR = r + d[0] * step;
                    int pathC = c + d[1] * step;
                    Piece onPath = grid[pathR][pathC].getPiece();
                    if (onPath == null) {
                        continue;
                    }
                    if (!piece.isOpponentOf(onPath) || jumped != null) {
                        blocked = true;
                        break;
                    }
                    jumped = new Point(pathR, pathC);
                }

                // each distance is judged on its own; a blocked path does not end the ray
                if (blocked) {
                    continue;
                }
                moves.add(jumped == null ? MoveDetail.plain(toR, toC) : MoveDetail.jumpOver(toR, toC, jumped));
            }
        }
        return moves;
    }

    /**
     * Validates and applies a move.
     *
     * @param mover      colour of the player making the move
     * @param legalMoves destinations computed for the piece on the source square
     * @return the captured piece, if any
     * @throws NoPieceException            if the source square is empty
     * @throws WrongColorException         if the source piece belongs to the opponent
     * @throws SameSquareException         if source and destination coincide
     * @throws IllegalDestinationException if the destination is not among {@code legalMoves}
     */
    public Optional<Piece> movePiece(int fromR, int fromC, int toR, int toC,
                                     PlayerColor mover, List<MoveDetail> legalMoves) {
        Piece moving = getPiece(fromR, fromC).orElseThrow(() -> new NoPieceException(
                "Invalid move: There is no piece at " + CoordinateCodec.format(fromR, fromC) + "."));

        if (moving.color() != mover) {
            throw new WrongColorException("Invalid move: You can't move your opponent's piece.");
        }
        if (fromR == toR && fromC == toC) {
            throw new SameSquareException("Invalid move: Destination must be different from origin.");
        }

        MoveDetail detail = legalMoves.stream()
                .filter(m -> m.targets(toR, toC))
                .findFirst()
                .orElseThrow(() -> new IllegalDestinationException(
                        "Invalid move: " + moving + " can't move to " + CoordinateCodec.format(toR, toC) + "."));

        Point capturedAt = null;
        if (detail.capture()) {
            if (moving.type() == PieceType.RUNNER) {
                if (detail.jumpedPiece() == null) {
                    throw new IllegalStateException("Runner capture to "
                            + CoordinateCodec.format(toR, toC) + " has no jumped piece");
                }
                capturedAt = detail.jumpedPiece();
            } else {
                capturedAt = new Point(toR, toC);
            }
        }

        grid[fromR][fromC].take();
        Piece captured = capturedAt == null ? null : grid[capturedAt.r()][capturedAt.c()].take();
        grid[toR][toC].setPiece(moving);
        return Optional.ofNullable(captured);
    }

    /** Snapshot of the pieces for rendering or comparison, null where empty. */
    public Piece[][] view() {
        Piece[][] v = new Piece[height][width];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                v[r][c] = grid[r][c].getPiece();
            }
        }
        return v;
    }
}
