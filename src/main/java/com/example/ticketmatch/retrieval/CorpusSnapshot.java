package com.example.ticketmatch.retrieval;

import com.example.ticketmatch.domain.TicketRecord;
import com.example.ticketmatch.exception.InvalidArgumentException;
import com.example.ticketmatch.exception.RecordNotFoundException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only view joining index slots to ticket records.
 * Slot order comes from the slot table, record lookup is by ticket id.
 */
public final class CorpusSnapshot {

    private final List<String> slotTicketIds;
    private final Map<String, TicketRecord> recordsById;

    private CorpusSnapshot(List<String> slotTicketIds, Map<String, TicketRecord> recordsById) {
        this.slotTicketIds = List.copyOf(slotTicketIds);
        this.recordsById = Collections.unmodifiableMap(recordsById);
    }

    /**
     * Snapshot for a freshly built index where slot {@code i} is {@code records.get(i)}.
     */
    public static CorpusSnapshot ofBuildOrder(List<TicketRecord> records) {
        Map<String, TicketRecord> byId = indexById(records);
        return new CorpusSnapshot(List.copyOf(byId.keySet()), byId);
    }

    /**
     * Attaches {@code records} to slot ids loaded from storage. Ids present in
     * the slot table but missing from the records are only detected when a
     * query reaches them.
     */
    public static CorpusSnapshot attach(List<String> slotTicketIds, List<TicketRecord> records) {
        return new CorpusSnapshot(slotTicketIds, indexById(records));
    }

    /**
     * @throws RecordNotFoundException when the slot is out of range or its ticket is not in the corpus
     */
    public TicketRecord recordForSlot(int slot) {
        if (slot < 0 || slot >= slotTicketIds.size()) {
            throw new RecordNotFoundException("Index slot " + slot + " is outside the slot table (size "
                    + slotTicketIds.size() + ")");
        }
        String ticketId = slotTicketIds.get(slot);
        TicketRecord record = recordsById.get(ticketId);
        if (record == null) {
            throw new RecordNotFoundException("Ticket " + ticketId + " at slot " + slot
                    + " is not in the attached corpus");
        }
        return record;
    }

    public List<String> slotTicketIds() {
        return slotTicketIds;
    }

    public int recordCount() {
        return recordsById.size();
    }

    /** Slot-table ids with no record in the corpus */
    public List<String> missingTicketIds() {
        return slotTicketIds.stream()
                .filter(id -> !recordsById.containsKey(id))
                .collect(Collectors.toList());
    }

    private static Map<String, TicketRecord> indexById(List<TicketRecord> records) {
        Map<String, TicketRecord> byId = new LinkedHashMap<>();
        for (TicketRecord record : records) {
            if (record.getTicketId() == null || record.getTicketId().isBlank()) {
                throw new InvalidArgumentException("Ticket record without an identifier");
            }
            if (byId.putIfAbsent(record.getTicketId(), record) != null) {
                throw new InvalidArgumentException("Duplicate ticket id " + record.getTicketId());
            }
        }
        return byId;
    }
}
