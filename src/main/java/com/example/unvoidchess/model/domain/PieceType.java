package com.example.unvoidchess.model.domain;

public enum PieceType {
    RUNNER, // jumps 1-3 squares in a line, captures by jumping over
    LEAPER, // L-shape, captures by landing
    ROYAL   // 1 square, captures by landing; losing it loses the game
}
