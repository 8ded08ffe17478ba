package com.example.lazycopy.exception;

/**
 * Thrown when a batcher is constructed with invalid options (e.g., maxItems <= 0).
 * Never thrown after construction.
 */
public class ValidationException extends Exception {

    public ValidationException(String message) {
        super(message);
    }
}
