package com.example.unvoidchess.exception;

public class IllegalDestinationException extends GameRuleException {

    public IllegalDestinationException(String message) {
        super(message);
    }
}
