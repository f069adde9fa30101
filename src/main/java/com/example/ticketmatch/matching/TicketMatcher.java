package com.example.ticketmatch.matching;

import com.example.ticketmatch.config.MatcherProperties;
import com.example.ticketmatch.domain.MatchResult;
import com.example.ticketmatch.domain.TicketQuery;
import com.example.ticketmatch.domain.TicketRecord;
import com.example.ticketmatch.embedding.EmbeddingGateway;
import com.example.ticketmatch.embedding.TicketTextNormalizer;
import com.example.ticketmatch.exception.IndexPersistenceException;
import com.example.ticketmatch.exception.IndexStateException;
import com.example.ticketmatch.exception.InvalidArgumentException;
import com.example.ticketmatch.exception.NotInitializedException;
import com.example.ticketmatch.exception.ProviderException;
import com.example.ticketmatch.index.IndexNeighbor;
import com.example.ticketmatch.index.SlotTable;
import com.example.ticketmatch.index.SlotTableStore;
import com.example.ticketmatch.index.TicketVectorIndex;
import com.example.ticketmatch.retrieval.CorpusSnapshot;
import com.example.ticketmatch.retrieval.RetrievalRanker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Entry point for similar-ticket retrieval.
 * <p>
 * Owns the embedding gateway handle, the vector index, the corpus and the
 * slot table. It becomes {@link MatcherState#READY} exactly once, either via
 * {@link #buildFromCorpus} or via {@link #loadIndex} followed by
 * {@link #attachCorpus}; queries are rejected until then. Once ready nothing
 * is mutated, so {@link #findSimilar} runs concurrently without locking.
 */
@Slf4j
@Service
public class TicketMatcher {

    private final MatcherProperties properties;
    private final EmbeddingGateway embeddingGateway;
    private final RetrievalRanker ranker;
    private final SlotTableStore slotTableStore;
    private final MeterRegistry meterRegistry;

    private final AtomicReference<MatcherState> state = new AtomicReference<>(MatcherState.UNINITIALIZED);

    // Written before the state moves forward, read only after it is observed.
    private volatile TicketVectorIndex index;
    private volatile SlotTable slotTable;
    private volatile CorpusSnapshot corpus;

    public TicketMatcher(MatcherProperties properties,
                         EmbeddingGateway embeddingGateway,
                         RetrievalRanker ranker,
                         SlotTableStore slotTableStore,
                         MeterRegistry meterRegistry) {
        this.properties = properties;
        this.embeddingGateway = embeddingGateway;
        this.ranker = ranker;
        this.slotTableStore = slotTableStore;
        this.meterRegistry = meterRegistry;
    }

    // ── Build path ──

    /**
     * Embeds every record, builds the index and, when an index path is
     * configured, saves index and slot table. Nothing is written unless the
     * whole build succeeds.
     *
     * @throws InvalidArgumentException for an empty corpus or duplicate ids
     * @throws ProviderException        when embedding fails; the build is abandoned
     * @throws IndexStateException      when another build or load is running, or already finished
     */
    public void buildFromCorpus(List<TicketRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new InvalidArgumentException("Cannot build an index from an empty corpus");
        }
        transition(MatcherState.UNINITIALIZED, MatcherState.INITIALIZING, "build");

        long start = System.currentTimeMillis();
        try {
            CorpusSnapshot snapshot = CorpusSnapshot.ofBuildOrder(records);
            log.info("Building ticket index from {} records with model {}",
                    records.size(), embeddingGateway.modelName());

            List<String> texts = records.stream()
                    .map(TicketTextNormalizer::normalize)
                    .collect(Collectors.toList());
            List<float[]> vectors = embeddingGateway.embedBatch(texts);
            if (vectors.size() != records.size()) {
                throw new ProviderException("Embedding provider returned " + vectors.size()
                        + " vectors for " + records.size() + " tickets");
            }

            MatcherProperties.IndexConfig cfg = properties.getIndex();
            TicketVectorIndex built = TicketVectorIndex.build(
                    vectors, embeddingGateway.dimension(), cfg.getM(), cfg.getEfConstruction(), cfg.getEf());

            SlotTable table = SlotTable.builder()
                    .dimension(built.dimension())
                    .size(built.size())
                    .embeddingModel(embeddingGateway.modelName())
                    .createdAt(Instant.now())
                    .ticketIds(snapshot.slotTicketIds())
                    .build();

            if (cfg.getPath() != null && !cfg.getPath().isBlank()) {
                persist(built, table, Path.of(cfg.getPath()), Path.of(cfg.resolvedSlotTablePath()));
            }

            this.index = built;
            this.slotTable = table;
            this.corpus = snapshot;
            state.set(MatcherState.READY);
            countBuild("success");
            log.info("Ticket index ready: {} vectors in {}ms", built.size(), System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            state.set(MatcherState.UNINITIALIZED);
            countBuild("failure");
            log.error("Ticket index build failed: {}", e.getMessage());
            throw e;
        }
    }

    // ── Load path ──

    /**
     * Loads a saved index and its slot table and checks that they agree with
     * each other and with the configured dimension.
     */
    public void loadIndex(Path indexPath, Path slotTablePath) {
        transition(MatcherState.UNINITIALIZED, MatcherState.INITIALIZING, "load");
        try {
            int dimension = embeddingGateway.dimension();
            TicketVectorIndex loaded = TicketVectorIndex.load(indexPath, dimension);
            SlotTable table = slotTableStore.load(slotTablePath);
            table.verifyMatches(loaded.size(), dimension);
            table.verifyChecksum(TicketVectorIndex.checksum(indexPath));
            loaded.setQueryQuality(properties.getIndex().getEf());

            if (table.getEmbeddingModel() != null && !table.getEmbeddingModel().equals(embeddingGateway.modelName())) {
                log.warn("Index at {} was built with model {} but queries will use {}",
                        indexPath, table.getEmbeddingModel(), embeddingGateway.modelName());
            }

            this.index = loaded;
            this.slotTable = table;
            state.set(MatcherState.INDEX_LOADED);
            log.info("Index loaded from {} ({} vectors, dim={})", indexPath, loaded.size(), dimension);
        } catch (RuntimeException e) {
            state.set(MatcherState.UNINITIALIZED);
            throw e;
        }
    }

    /**
     * Joins the loaded slot table to the ticket records and makes the matcher ready.
     * On failure the loaded index is dropped and the matcher is uninitialized again.
     */
    public void attachCorpus(List<TicketRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new InvalidArgumentException("Cannot attach an empty corpus");
        }
        transition(MatcherState.INDEX_LOADED, MatcherState.INITIALIZING, "attach corpus");
        try {
            CorpusSnapshot snapshot = CorpusSnapshot.attach(slotTable.getTicketIds(), records);

            List<String> missing = snapshot.missingTicketIds();
            if (!missing.isEmpty()) {
                log.warn("{} indexed tickets are missing from the corpus (e.g. {}); queries reaching them will fail",
                        missing.size(), missing.get(0));
            }
            List<String> rowOrder = records.stream().map(TicketRecord::getTicketId).collect(Collectors.toList());
            if (!rowOrder.equals(slotTable.getTicketIds())) {
                log.warn("Corpus row order differs from the slot table; joining by ticket id");
            }

            this.corpus = snapshot;
            state.set(MatcherState.READY);
            log.info("Attached corpus of {} records; matcher ready", snapshot.recordCount());
        } catch (RuntimeException e) {
            // a failed attach discards the loaded index so that a fresh load or build can follow
            this.index = null;
            this.slotTable = null;
            state.set(MatcherState.UNINITIALIZED);
            throw e;
        }
    }

    // ── Query ──

    /**
     * Normalizes and embeds the query ticket, fetches its {@code k} nearest
     * neighbours and ranks them. An empty list means nothing cleared the threshold.
     *
     * @throws NotInitializedException before the matcher is ready
     * @throws InvalidArgumentException when {@code k <= 0} or the threshold is NaN
     */
    public List<MatchResult> findSimilar(String issue, String category, String description, int k, double threshold) {
        if (state.get() != MatcherState.READY) {
            throw new NotInitializedException("Ticket index is not ready (state " + state.get() + ")");
        }
        if (k <= 0) {
            throw new InvalidArgumentException("k must be positive, got " + k);
        }
        if (Double.isNaN(threshold)) {
            throw new InvalidArgumentException("threshold must be a number");
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try {
            String text = TicketTextNormalizer.normalize(issue, category, description);
            float[] vector = embeddingGateway.embed(text);
            List<IndexNeighbor> neighbours = index.query(vector, k);
            List<MatchResult> matches = ranker.rank(neighbours, corpus, threshold);

            outcome = matches.isEmpty() ? "empty" : "matched";
            log.debug("Query '{}' (k={}, threshold={}): {} of {} neighbours kept",
                    text, k, threshold, matches.size(), neighbours.size());
            return matches;
        } finally {
            sample.stop(Timer.builder("ticket_matcher.query.duration")
                    .tag("outcome", outcome)
                    .register(meterRegistry));
            Counter.builder("ticket_matcher.query.total")
                    .tag("outcome", outcome)
                    .register(meterRegistry)
                    .increment();
        }
    }

    /**
     * Same as {@link #findSimilar(String, String, String, int, double)} with
     * configured defaults for a missing {@code k} or threshold.
     */
    public List<MatchResult> findSimilar(TicketQuery query) {
        MatcherProperties.RetrievalConfig defaults = properties.getRetrieval();
        int k = query.getK() != null ? query.getK() : defaults.getDefaultK();
        double threshold = query.getThreshold() != null ? query.getThreshold() : defaults.getDefaultThreshold();
        return findSimilar(query.getIssue(), query.getCategory(), query.getDescription(), k, threshold);
    }

    // ── Status ──

    public MatcherState getState() {
        return state.get();
    }

    public boolean isReady() {
        return state.get() == MatcherState.READY;
    }

    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("state", state.get().name());
        status.put("embeddingModel", embeddingGateway.modelName());
        status.put("dimension", embeddingGateway.dimension());
        status.put("indexPath", properties.getIndex().getPath());
        status.put("corpusPath", properties.getCorpus().getPath());
        TicketVectorIndex current = index;
        if (current != null) {
            status.put("indexSize", current.size());
            status.put("ef", current.getQueryQuality());
        }
        SlotTable table = slotTable;
        if (table != null && table.getCreatedAt() != null) {
            status.put("indexCreatedAt", table.getCreatedAt().toString());
        }
        CorpusSnapshot snapshot = corpus;
        if (snapshot != null) {
            status.put("corpusSize", snapshot.recordCount());
        }
        return status;
    }

    // ── Helpers ──

    private void transition(MatcherState expected, MatcherState next, String operation) {
        if (!state.compareAndSet(expected, next)) {
            throw new IndexStateException("Cannot " + operation + " while matcher is " + state.get()
                    + " (expected " + expected + ")");
        }
    }

    /**
     * Writes index and slot table to temporary siblings and moves them into
     * place only after both writes succeeded. The slot table records the
     * checksum of the index file it belongs to.
     */
    private void persist(TicketVectorIndex built, SlotTable table, Path indexPath, Path slotPath) {
        Path indexTmp = indexPath.resolveSibling(indexPath.getFileName() + ".tmp");
        Path slotTmp = slotPath.resolveSibling(slotPath.getFileName() + ".tmp");
        try {
            built.save(indexTmp);
            table.setIndexChecksum(TicketVectorIndex.checksum(indexTmp));
            slotTableStore.save(table, slotTmp);

            moveIntoPlace(slotTmp, slotPath);
            moveIntoPlace(indexTmp, indexPath);
        } finally {
            deleteQuietly(indexTmp);
            deleteQuietly(slotTmp);
        }
        log.info("Index saved to {} (slot table {})", indexPath, slotPath);
    }

    private static void moveIntoPlace(Path source, Path target) {
        try {
            try {
                Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new IndexPersistenceException("Failed to move " + source + " to " + target, e);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", path, e.getMessage());
        }
    }

    private void countBuild(String outcome) {
        Counter.builder("ticket_matcher.index.builds")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
