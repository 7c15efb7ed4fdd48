package com.example.unvoidchess.exception;

public class GameOverException extends GameRuleException {

    public GameOverException(String message) {
        super(message);
    }
}
