package com.example.unvoidchess.exception;

public class SameSquareException extends GameRuleException {

    public SameSquareException(String message) {
        super(message);
    }
}
