package com.example.unvoidchess.exception;

public class NoPieceException extends GameRuleException {

    public NoPieceException(String message) {
        super(message);
    }
}
