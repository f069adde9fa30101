package com.example.ticketmatch.exception;

/**
 * Base type for every failure raised by the matching engine.
 * Each subtype carries a stable code that the HTTP layer reports verbatim.
 */
public abstract class TicketMatchingException extends RuntimeException {

    protected TicketMatchingException(String message) {
        super(message);
    }

    protected TicketMatchingException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getCode();
}
