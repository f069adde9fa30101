package com.example.ticketmatch.matching;

import com.example.ticketmatch.config.MatcherProperties;
import com.example.ticketmatch.domain.TicketRecord;
import com.example.ticketmatch.store.TicketRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Brings the {@link TicketMatcher} to READY on startup from the configured
 * corpus file, either by loading a saved index or by building a new one.
 * A missing corpus file is an error, never a silent no-op.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IndexBootstrap {

    private final MatcherProperties properties;
    private final TicketMatcher matcher;
    private final TicketRecordStore recordStore;

    private volatile String lastError;

    @EventListener(ApplicationReadyEvent.class)
    @Async("indexExecutor")
    public void onStartup() {
        if (!properties.getBootstrap().isEnabled()) {
            log.info("Index bootstrap disabled, matcher stays {}", matcher.getState());
            return;
        }
        try {
            initialize();
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            log.error("Index bootstrap failed; queries will be rejected until an index is built", e);
        }
    }

    /**
     * Runs the configured bootstrap mode once.
     */
    public void initialize() {
        MatcherProperties.BootstrapConfig.Mode mode = properties.getBootstrap().getMode();
        Path indexPath = Path.of(properties.getIndex().getPath());
        boolean loadable = Files.isRegularFile(indexPath);

        switch (mode) {
            case LOAD -> loadFromStorage();
            case BUILD -> buildFromCorpusFile();
            default -> {
                if (loadable) {
                    loadFromStorage();
                } else {
                    log.info("No index at {}, building from corpus", indexPath);
                    buildFromCorpusFile();
                }
            }
        }
        lastError = null;
    }

    /**
     * Reads the configured CSV and builds (and saves) a fresh index.
     */
    public void buildFromCorpusFile() {
        List<TicketRecord> records = recordStore.loadAll(Path.of(properties.getCorpus().getPath()));
        matcher.buildFromCorpus(records);
    }

    /**
     * Loads index + slot table from the configured paths and attaches the CSV corpus.
     * The corpus is read first so a missing data file fails before any index state changes.
     */
    public void loadFromStorage() {
        List<TicketRecord> records = recordStore.loadAll(Path.of(properties.getCorpus().getPath()));
        MatcherProperties.IndexConfig cfg = properties.getIndex();
        matcher.loadIndex(Path.of(cfg.getPath()), Path.of(cfg.resolvedSlotTablePath()));
        matcher.attachCorpus(records);
    }

    public String getLastError() {
        return lastError;
    }
}
