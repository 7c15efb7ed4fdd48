package com.example.unvoidchess.exception;

/**
 * A square label that cannot be mapped onto the current board.
 */
public abstract class InvalidCoordinateException extends IllegalArgumentException {

    private final String label;

    protected InvalidCoordinateException(String label, String message) {
        super(message);
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
