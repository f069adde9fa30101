package com.example.ticketmatch.retrieval;

import com.example.ticketmatch.domain.MatchResult;
import com.example.ticketmatch.index.IndexNeighbor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns raw index hits into ranked matches.
 * <p>
 * Hits scoring below the threshold are dropped outright. Survivors are
 * ordered resolved-first, then by similarity descending; the sort is stable,
 * so index order breaks remaining ties. A resolved ticket outranks a more
 * similar unresolved one because it carries a usable resolution.
 */
@Component
public class RetrievalRanker {

    static final Comparator<MatchResult> RESOLVED_FIRST = Comparator
            .comparing(MatchResult::isResolved).reversed()
            .thenComparing(Comparator.comparingDouble(MatchResult::getSimilarityScore).reversed());

    /**
     * @throws com.example.ticketmatch.exception.RecordNotFoundException when a
     *         surviving hit cannot be joined to the corpus; the whole query fails
     */
    public List<MatchResult> rank(List<IndexNeighbor> neighbours, CorpusSnapshot corpus, double threshold) {
        List<MatchResult> matches = new ArrayList<>(neighbours.size());
        for (IndexNeighbor neighbour : neighbours) {
            double similarity = neighbour.similarity();
            // also drops NaN scores from zero vectors
            if (!(similarity >= threshold)) continue;
            matches.add(MatchResult.of(corpus.recordForSlot(neighbour.slot()), similarity));
        }
        matches.sort(RESOLVED_FIRST);
        return matches;
    }
}
