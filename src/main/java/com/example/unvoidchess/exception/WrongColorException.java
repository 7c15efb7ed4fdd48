package com.example.unvoidchess.exception;

public class WrongColorException extends GameRuleException {

    public WrongColorException(String message) {
        super(message);
    }
}
