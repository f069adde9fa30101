package com.example.ticketmatch.exception;

/**
 * Raised when a query arrives before the index and corpus are ready.
 */
public class NotInitializedException extends TicketMatchingException {

    public NotInitializedException(String message) {
        super(message);
    }

    public NotInitializedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "not_initialized";
    }
}
