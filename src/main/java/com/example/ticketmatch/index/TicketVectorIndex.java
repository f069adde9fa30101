package com.example.ticketmatch.index;

import com.example.ticketmatch.exception.IndexPersistenceException;
import com.example.ticketmatch.exception.InvalidArgumentException;
import com.github.jelmerk.knn.DistanceFunctions;
import com.github.jelmerk.knn.SearchResult;
import com.github.jelmerk.knn.hnsw.HnswIndex;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Approximate nearest-neighbour index over ticket embeddings, using cosine
 * distance on a hierarchical navigable small world graph.
 * <p>
 * Vectors get dense slot ids in insertion order (0..n-1), so slot {@code i}
 * always belongs to the i-th vector passed to {@link #build}. The graph is
 * never mutated after build or load; concurrent queries are safe.
 * <p>
 * When {@code k} exceeds the element count, queries return
 * {@code min(k, size)} results instead of failing.
 */
@Slf4j
public class TicketVectorIndex {

    public static final int DEFAULT_EF = 50;

    private final HnswIndex<Integer, float[], SlotVector, Float> index;
    private final int dimension;

    private TicketVectorIndex(HnswIndex<Integer, float[], SlotVector, Float> index, int dimension) {
        this.index = index;
        this.dimension = dimension;
    }

    /**
     * Builds an index with capacity for exactly {@code vectors.size()} elements.
     *
     * @param m              graph degree
     * @param efConstruction candidate list size while inserting
     * @param ef             initial query quality
     * @throws InvalidArgumentException when {@code vectors} is empty or a vector has the wrong dimension
     */
    public static TicketVectorIndex build(List<float[]> vectors, int dimension, int m, int efConstruction, int ef) {
        if (vectors == null || vectors.isEmpty()) {
            throw new InvalidArgumentException("Cannot build an index from an empty corpus");
        }
        if (dimension <= 0 || m <= 0 || efConstruction <= 0) {
            throw new InvalidArgumentException("dimension, m and efConstruction must be positive");
        }

        HnswIndex<Integer, float[], SlotVector, Float> hnsw = HnswIndex
                .newBuilder(dimension, DistanceFunctions.FLOAT_COSINE_DISTANCE, vectors.size())
                .withM(m)
                .withEfConstruction(efConstruction)
                .withEf(ef > 0 ? ef : DEFAULT_EF)
                .build();

        for (int slot = 0; slot < vectors.size(); slot++) {
            float[] vector = vectors.get(slot);
            if (vector == null || vector.length != dimension) {
                throw new InvalidArgumentException("Vector at slot " + slot + " has dimension "
                        + (vector == null ? 0 : vector.length) + ", expected " + dimension);
            }
            hnsw.add(new SlotVector(slot, vector));
        }

        log.debug("Built HNSW index: {} vectors, dim={}, M={}, efConstruction={}",
                vectors.size(), dimension, m, efConstruction);
        return new TicketVectorIndex(hnsw, dimension);
    }

    /**
     * Reads an index written by {@link #save}.
     *
     * @throws IndexPersistenceException when the file is missing, unreadable,
     *                                   or was built for another dimension
     */
    public static TicketVectorIndex load(Path path, int expectedDimension) {
        if (!Files.isRegularFile(path)) {
            throw new IndexPersistenceException("Index file not found at " + path);
        }

        HnswIndex<Integer, float[], SlotVector, Float> hnsw;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            hnsw = HnswIndex.load(in);
        } catch (IOException | RuntimeException e) {
            throw new IndexPersistenceException("Index file at " + path + " is unreadable or corrupt", e);
        }

        if (hnsw.getDimensions() != expectedDimension) {
            throw new IndexPersistenceException("Index at " + path + " has dimension "
                    + hnsw.getDimensions() + ", expected " + expectedDimension);
        }
        return new TicketVectorIndex(hnsw, expectedDimension);
    }

    /**
     * Sets the candidate list size for subsequent queries. Higher is more
     * accurate and slower.
     */
    public void setQueryQuality(int ef) {
        if (ef <= 0) {
            throw new InvalidArgumentException("ef must be positive, got " + ef);
        }
        index.setEf(ef);
    }

    public int getQueryQuality() {
        return index.getEf();
    }

    /**
     * Returns up to {@code min(k, size())} neighbours ordered by increasing distance.
     */
    public List<IndexNeighbor> query(float[] vector, int k) {
        if (k <= 0) {
            throw new InvalidArgumentException("k must be positive, got " + k);
        }
        if (vector == null || vector.length != dimension) {
            throw new InvalidArgumentException("Query vector has dimension "
                    + (vector == null ? 0 : vector.length) + ", expected " + dimension);
        }

        int effectiveK = Math.min(k, size());
        if (effectiveK == 0) return List.of();

        List<SearchResult<SlotVector, Float>> results = index.findNearest(vector, effectiveK);
        return results.stream()
                .map(r -> new IndexNeighbor(r.item().id(), r.distance()))
                .sorted(Comparator.comparingDouble(IndexNeighbor::distance))
                .limit(effectiveK)
                .collect(Collectors.toList());
    }

    /**
     * Serializes the graph and its vectors to {@code path}, creating parent directories.
     */
    public void save(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(path))) {
                index.save(out);
            }
        } catch (IOException e) {
            throw new IndexPersistenceException("Failed to save index to " + path, e);
        }
        log.debug("Saved HNSW index with {} vectors to {}", size(), path);
    }

    /**
     * SHA-256 of a saved index file, recorded in the slot table so that a
     * table is never paired with an index from another build.
     */
    public static String checksum(Path path) {
        try (DigestInputStream in = new DigestInputStream(
                new BufferedInputStream(Files.newInputStream(path)), MessageDigest.getInstance("SHA-256"))) {
            in.transferTo(OutputStream.nullOutputStream());
            return HexFormat.of().formatHex(in.getMessageDigest().digest());
        } catch (IOException e) {
            throw new IndexPersistenceException("Failed to read index file at " + path, e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public int size() {
        return index.size();
    }

    public int dimension() {
        return dimension;
    }
}
