package com.example.unvoidchess.model.domain;

public enum GamePhase {
    IN_PROGRESS, // a match is being played
    GAME_OVER    // a Royal was captured; only restart leaves this phase
}
