package com.example.ticketmatch.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An incoming ticket to match against the corpus.
 * {@code k} and {@code threshold} fall back to the configured defaults when null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TicketQuery {

    private String issue;
    private String category;
    private String description;
    private Integer k;
    private Double threshold;
}
