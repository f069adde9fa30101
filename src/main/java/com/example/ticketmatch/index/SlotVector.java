package com.example.ticketmatch.index;

import com.github.jelmerk.knn.Item;

import java.io.Serial;

/**
 * A vector stored in the HNSW graph under its dense slot id.
 */
public record SlotVector(Integer id, float[] vector) implements Item<Integer, float[]> {

    @Serial
    private static final long serialVersionUID = 1L;

    @Override
    public int dimensions() {
        return vector.length;
    }
}
