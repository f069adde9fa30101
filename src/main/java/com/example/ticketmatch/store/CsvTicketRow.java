package com.example.ticketmatch.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of the ticket CSV, with the column headers of the exported data set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"Ticket ID", "Issue", "Category", "Description", "Resolved", "Resolution"})
class CsvTicketRow {

    @JsonProperty("Ticket ID")
    private String ticketId;

    @JsonProperty("Issue")
    private String issue;

    @JsonProperty("Category")
    private String category;

    @JsonProperty("Description")
    private String description;

    /** Kept as text: exports use True/False, 1/0 or yes/no */
    @JsonProperty("Resolved")
    private String resolved;

    @JsonProperty("Resolution")
    private String resolution;
}
