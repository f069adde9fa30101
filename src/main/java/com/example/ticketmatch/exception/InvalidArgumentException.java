package com.example.ticketmatch.exception;

/**
 * A caller supplied an argument the engine cannot work with, such as {@code k <= 0} or an empty corpus.
 */
public class InvalidArgumentException extends TicketMatchingException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "invalid_argument";
    }
}
