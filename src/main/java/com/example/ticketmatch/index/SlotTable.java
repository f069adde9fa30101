package com.example.ticketmatch.index;

import com.example.ticketmatch.exception.IndexPersistenceException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Slot id → ticket id table persisted beside the index file.
 * {@code ticketIds.get(slot)} is the ticket embedded at that slot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlotTable {

    private int dimension;
    private int size;
    private String embeddingModel;
    private Instant createdAt;

    /** SHA-256 of the index file written together with this table */
    private String indexChecksum;

    @Builder.Default
    private List<String> ticketIds = new ArrayList<>();

    /**
     * Fails unless this table describes an index of {@code indexSize} vectors
     * of {@code indexDimension} with one unique ticket id per slot.
     */
    public void verifyMatches(int indexSize, int indexDimension) {
        if (dimension != indexDimension) {
            throw new IndexPersistenceException("Slot table dimension " + dimension
                    + " does not match index dimension " + indexDimension);
        }
        if (size != indexSize || ticketIds == null || ticketIds.size() != indexSize) {
            throw new IndexPersistenceException("Slot table lists "
                    + (ticketIds == null ? 0 : ticketIds.size()) + " tickets (size " + size
                    + ") but the index holds " + indexSize);
        }
        if (new HashSet<>(ticketIds).size() != ticketIds.size()) {
            throw new IndexPersistenceException("Slot table contains duplicate ticket ids");
        }
    }

    /**
     * Fails when this table was written for a different index file. Tables
     * without a recorded checksum are accepted.
     */
    public void verifyChecksum(String actualIndexChecksum) {
        if (indexChecksum != null && !indexChecksum.equals(actualIndexChecksum)) {
            throw new IndexPersistenceException("Slot table was written for another index file (checksum "
                    + indexChecksum + ", found " + actualIndexChecksum + ")");
        }
    }
}
