package com.circuitbox.backend.exception;

/**
 * Raised by a health probe that could not reach its circuit.
 */
public class ProbeException extends RuntimeException {
    public ProbeException(String message) {
        super(message);
    }

    public ProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
