package com.example.ticketmatch.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A previously recorded support ticket.
 * Text fields are never null: absent values are held as empty strings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketRecord {

    /** Externally assigned, unique and stable */
    private String ticketId;

    @Builder.Default
    private String issue = "";

    @Builder.Default
    private String category = "";

    @Builder.Default
    private String description = "";

    private boolean resolved;

    /** Empty when the ticket is unresolved */
    @Builder.Default
    private String resolution = "";
}
