package com.example.ticketmatch.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One ranked neighbour of a query ticket, with a snapshot of the matched record.
 * Produced per query and never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchResult {

    @JsonProperty("ticket_id")
    private String ticketId;

    /** {@code 1 - cosine distance} */
    @JsonProperty("similarity_score")
    private double similarityScore;

    private String issue;
    private String category;
    private String description;
    private boolean resolved;
    private String resolution;

    public static MatchResult of(TicketRecord record, double similarity) {
        return MatchResult.builder()
                .ticketId(record.getTicketId())
                .similarityScore(similarity)
                .issue(record.getIssue())
                .category(record.getCategory())
                .description(record.getDescription())
                .resolved(record.isResolved())
                .resolution(record.getResolution() != null ? record.getResolution() : "")
                .build();
    }
}
