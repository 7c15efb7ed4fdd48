package com.example.unvoidchess.model.domain;

public enum PlayerColor {
    FIRST("White"),  // moves first, home row 0
    SECOND("Black"); // home row is the top row

    private final String displayName;

    PlayerColor(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public PlayerColor opponent() {
        return this == FIRST ? SECOND : FIRST;
    }
}
