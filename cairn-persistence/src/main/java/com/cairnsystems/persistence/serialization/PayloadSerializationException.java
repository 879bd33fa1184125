package com.cairnsystems.persistence.serialization;

/**
 * Raised by a {@link PayloadSerializer} that cannot convert a payload.
 */
public class PayloadSerializationException extends RuntimeException {

    public PayloadSerializationException(String message) {
        super(message);
    }

    public PayloadSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
