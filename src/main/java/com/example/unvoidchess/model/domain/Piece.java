package com.example.unvoidchess.model.domain;

/**
 * Immutable piece value. Squares hold their own copy, a piece is never shared.
 */
public record Piece(PieceType type, PlayerColor color) {

    public boolean isOpponentOf(Piece other) {
        return other != null && other.color != color;
    }

    public String symbol() {
        return switch (type) {
            case ROYAL -> color == PlayerColor.FIRST ? "♔" : "♚";
            case RUNNER -> color == PlayerColor.FIRST ? "♖" : "♜";
            case LEAPER -> color == PlayerColor.FIRST ? "♘" : "♞";
        };
    }

    @Override
    public String toString() {
        return symbol();
    }
}
