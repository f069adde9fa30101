package com.example.ticketmatch.exception;

/**
 * The embedding or generation provider was unreachable or answered with something unusable.
 */
public class ProviderException extends TicketMatchingException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "provider_error";
    }
}
