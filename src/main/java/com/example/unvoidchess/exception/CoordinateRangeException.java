package com.example.unvoidchess.exception;

public class CoordinateRangeException extends InvalidCoordinateException {

    public CoordinateRangeException(String label, String message) {
        super(label, message);
    }
}
