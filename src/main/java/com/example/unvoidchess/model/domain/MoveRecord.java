package com.example.unvoidchess.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MoveRecord {
    private PlayerColor player;
    private Piece piece;
    private Point from;
    private Point to;
    private Piece captured; // null if nothing was taken

    public boolean isCapture() {
        return captured != null;
    }

    public boolean isRoyalCaptured() {
        return captured != null && captured.type() == PieceType.ROYAL;
    }
}
