package com.example.ticketmatch.embedding;

import com.example.ticketmatch.domain.TicketQuery;
import com.example.ticketmatch.domain.TicketRecord;

/**
 * Derives the single comparison string embedded for a ticket.
 * <p>
 * Index-time and query-time text must come from this class so that the same
 * three fields always yield the same string.
 */
public final class TicketTextNormalizer {

    private TicketTextNormalizer() {
    }

    /**
     * Joins issue, category and description with single spaces and strips the
     * result. A null field counts as an empty string.
     */
    public static String normalize(String issue, String category, String description) {
        return (orEmpty(issue) + " " + orEmpty(category) + " " + orEmpty(description)).strip();
    }

    public static String normalize(TicketRecord record) {
        return normalize(record.getIssue(), record.getCategory(), record.getDescription());
    }

    public static String normalize(TicketQuery query) {
        return normalize(query.getIssue(), query.getCategory(), query.getDescription());
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
