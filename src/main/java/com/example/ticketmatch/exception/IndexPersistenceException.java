package com.example.ticketmatch.exception;

/**
 * The index, slot table or corpus file is missing, corrupt, or disagrees with the configured dimension.
 */
public class IndexPersistenceException extends TicketMatchingException {

    public IndexPersistenceException(String message) {
        super(message);
    }

    public IndexPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "persistence_error";
    }
}
