package com.example.ticketmatch.index;

import com.example.ticketmatch.exception.IndexPersistenceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link SlotTable} as JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotTableStore {

    private final ObjectMapper objectMapper;

    public void save(SlotTable table, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), table);
            log.debug("Saved slot table ({} slots) to {}", table.getSize(), path);
        } catch (IOException e) {
            throw new IndexPersistenceException("Failed to save slot table to " + path, e);
        }
    }

    public SlotTable load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IndexPersistenceException("Slot table not found at " + path);
        }
        try {
            return objectMapper.readValue(path.toFile(), SlotTable.class);
        } catch (IOException e) {
            throw new IndexPersistenceException("Slot table at " + path + " is unreadable", e);
        }
    }
}
