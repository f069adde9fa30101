package com.example.ticketmatch.store;

import com.example.ticketmatch.domain.TicketRecord;

import java.nio.file.Path;
import java.util.List;

/**
 * Durable tabular storage for ticket records. Row order is preserved in both
 * directions because it defines slot assignment at build time.
 */
public interface TicketRecordStore {

    List<TicketRecord> loadAll(Path path);

    void saveAll(List<TicketRecord> records, Path path);
}
