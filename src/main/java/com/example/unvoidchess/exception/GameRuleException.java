package com.example.unvoidchess.exception;

/**
 * Base type for every rejected selection or move. A rule violation never
 * leaves the board or game half-updated.
 */
public abstract class GameRuleException extends IllegalStateException {

    protected GameRuleException(String message) {
        super(message);
    }
}
