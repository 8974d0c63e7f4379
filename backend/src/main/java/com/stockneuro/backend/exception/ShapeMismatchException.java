package com.stockneuro.backend.exception;

public class ShapeMismatchException extends RuntimeException {
    public ShapeMismatchException(String message) {
        super(message);
    }

    public ShapeMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
