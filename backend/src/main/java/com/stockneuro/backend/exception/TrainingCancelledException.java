package com.stockneuro.backend.exception;

public class TrainingCancelledException extends RuntimeException {
    public TrainingCancelledException(String message) {
        super(message);
    }

    public TrainingCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
