package com.example.unvoidchess.model.domain;

/**
 * One candidate destination for a piece.
 *
 * @param toR         destination row
 * @param toC         destination column
 * @param capture     whether the move removes an opponent piece
 * @param jumpedPiece square of the piece removed by a Runner capture, null otherwise
 */
public record MoveDetail(int toR, int toC, boolean capture, Point jumpedPiece) {

    public static MoveDetail plain(int toR, int toC) {
        return new MoveDetail(toR, toC, false, null);
    }

    public static MoveDetail landing(int toR, int toC) {
        return new MoveDetail(toR, toC, true, null);
    }

    public static MoveDetail jumpOver(int toR, int toC, Point jumped) {
        return new MoveDetail(toR, toC, true, jumped);
    }

    public boolean targets(int r, int c) {
        return toR == r && toC == c;
    }
}
