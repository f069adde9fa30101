package com.example.ticketmatch.exception;

/**
 * A build or load was requested while another one is running or after the index became ready.
 */
public class IndexStateException extends TicketMatchingException {

    public IndexStateException(String message) {
        super(message);
    }

    public IndexStateException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "invalid_state";
    }
}
