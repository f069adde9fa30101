package com.example.ticketmatch.exception;

/**
 * An index slot resolved to a ticket id absent from the attached corpus. Signals a corpus/index mismatch.
 */
public class RecordNotFoundException extends TicketMatchingException {

    public RecordNotFoundException(String message) {
        super(message);
    }

    public RecordNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "record_not_found";
    }
}
