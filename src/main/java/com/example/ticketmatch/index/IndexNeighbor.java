package com.example.ticketmatch.index;

/**
 * A raw query hit: slot id plus cosine distance to the query vector.
 */
public record IndexNeighbor(int slot, float distance) {

    /** Ranking always scores a hit as {@code 1 - distance}. */
    public double similarity() {
        return 1.0 - distance;
    }
}
