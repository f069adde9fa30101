package com.example.ticketmatch.store;

import com.example.ticketmatch.domain.TicketRecord;
import com.example.ticketmatch.exception.IndexPersistenceException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ticket records in a CSV file with a header row.
 * Absent text columns read as empty strings and an absent resolved flag as false.
 */
@Slf4j
@Component
public class CsvTicketRecordStore implements TicketRecordStore {

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "y", "t");

    private final CsvMapper csvMapper = new CsvMapper();

    @Override
    public List<TicketRecord> loadAll(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IndexPersistenceException("Ticket data file not found at " + path);
        }

        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<CsvTicketRow> rows;
        try (MappingIterator<CsvTicketRow> it = csvMapper.readerFor(CsvTicketRow.class)
                .with(schema)
                .readValues(path.toFile())) {
            rows = it.readAll();
        } catch (IOException e) {
            throw new IndexPersistenceException("Ticket data file at " + path + " is unreadable", e);
        }

        List<TicketRecord> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            CsvTicketRow row = rows.get(i);
            if (row.getTicketId() == null || row.getTicketId().isBlank()) {
                throw new IndexPersistenceException("Row " + (i + 1) + " of " + path + " has no Ticket ID");
            }
            records.add(toRecord(row));
        }
        log.info("Loaded {} ticket records from {}", records.size(), path);
        return records;
    }

    @Override
    public void saveAll(List<TicketRecord> records, Path path) {
        CsvSchema schema = csvMapper.schemaFor(CsvTicketRow.class).withHeader();
        List<CsvTicketRow> rows = records.stream()
                .map(CsvTicketRecordStore::toRow)
                .collect(Collectors.toList());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            csvMapper.writer(schema).writeValue(path.toFile(), rows);
        } catch (IOException e) {
            throw new IndexPersistenceException("Failed to write ticket data to " + path, e);
        }
        log.info("Wrote {} ticket records to {}", records.size(), path);
    }

    static TicketRecord toRecord(CsvTicketRow row) {
        return TicketRecord.builder()
                .ticketId(row.getTicketId().strip())
                .issue(orEmpty(row.getIssue()))
                .category(orEmpty(row.getCategory()))
                .description(orEmpty(row.getDescription()))
                .resolved(parseFlag(row.getResolved()))
                .resolution(orEmpty(row.getResolution()))
                .build();
    }

    private static CsvTicketRow toRow(TicketRecord record) {
        return new CsvTicketRow(record.getTicketId(), record.getIssue(), record.getCategory(),
                record.getDescription(), record.isResolved() ? "True" : "False", record.getResolution());
    }

    static boolean parseFlag(String value) {
        return value != null && TRUE_VALUES.contains(value.strip().toLowerCase(Locale.ROOT));
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
