package com.stockneuro.backend.exception;

public class CalibrationInsufficientException extends RuntimeException {
    public CalibrationInsufficientException(String message) {
        super(message);
    }

    public CalibrationInsufficientException(String message, Throwable cause) {
        super(message, cause);
    }
}
