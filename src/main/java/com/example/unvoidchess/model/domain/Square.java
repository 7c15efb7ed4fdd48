package com.example.unvoidchess.model.domain;

import lombok.Data;

@Data
public class Square {
    private Piece piece; // null when empty

    public boolean isEmpty() {
        return piece == null;
    }

    public Piece take() {
        Piece taken = this.piece;
        this.piece = null;
        return taken;
    }
}
