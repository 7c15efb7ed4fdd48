package com.example.unvoidchess.exception;

public class CoordinateFormatException extends InvalidCoordinateException {

    public CoordinateFormatException(String label, String message) {
        super(label, message);
    }
}
