package com.example.ticketmatch.retrieval;

import com.example.ticketmatch.domain.MatchResult;
import com.example.ticketmatch.domain.TicketRecord;
import com.example.ticketmatch.exception.InvalidArgumentException;
import com.example.ticketmatch.exception.RecordNotFoundException;
import com.example.ticketmatch.index.IndexNeighbor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RetrievalRankerTest {

    private final RetrievalRanker ranker = new RetrievalRanker();

    private static TicketRecord ticket(String id, boolean resolved) {
        return TicketRecord.builder()
                .ticketId(id)
                .issue("Issue " + id)
                .resolved(resolved)
                .resolution(resolved ? "Fixed " + id : "")
                .build();
    }

    private final CorpusSnapshot corpus = CorpusSnapshot.ofBuildOrder(List.of(
            ticket("A", false),
            ticket("B", true),
            ticket("C", false),
            ticket("D", true)));

    @Test
    void dropsHitsBelowThreshold() {
        List<MatchResult> matches = ranker.rank(List.of(
                new IndexNeighbor(0, 0.1f),
                new IndexNeighbor(2, 0.6f)), corpus, 0.5);

        assertThat(matches).extracting(MatchResult::getTicketId).containsExactly("A");
        assertThat(matches.get(0).getSimilarityScore()).isCloseTo(0.9, within(1e-6));
    }

    @Test
    void thresholdIsInclusive() {
        List<MatchResult> matches = ranker.rank(List.of(new IndexNeighbor(0, 0.5f)), corpus, 0.5);

        assertThat(matches).hasSize(1);
    }

    @Test
    void resolvedTicketOutranksEquallySimilarUnresolvedOne() {
        List<MatchResult> matches = ranker.rank(List.of(
                new IndexNeighbor(0, 0.1f),
                new IndexNeighbor(1, 0.1f)), corpus, 0.5);

        assertThat(matches).extracting(MatchResult::getTicketId).containsExactly("B", "A");
    }

    @Test
    void resolvedTicketOutranksMoreSimilarUnresolvedOne() {
        List<MatchResult> matches = ranker.rank(List.of(
                new IndexNeighbor(0, 0.05f),
                new IndexNeighbor(2, 0.1f),
                new IndexNeighbor(1, 0.3f)), corpus, 0.5);

        assertThat(matches).extracting(MatchResult::getTicketId).containsExactly("B", "A", "C");
        assertThat(matches.get(0).getResolution()).isEqualTo("Fixed B");
    }

    @Test
    void similarityOrdersWithinEachGroup() {
        List<MatchResult> matches = ranker.rank(List.of(
                new IndexNeighbor(1, 0.3f),
                new IndexNeighbor(3, 0.2f),
                new IndexNeighbor(2, 0.25f),
                new IndexNeighbor(0, 0.35f)), corpus, 0.0);

        assertThat(matches).extracting(MatchResult::getTicketId).containsExactly("D", "B", "C", "A");
    }

    @Test
    void fullTiesKeepIndexOrder() {
        List<MatchResult> matches = ranker.rank(List.of(
                new IndexNeighbor(2, 0.2f),
                new IndexNeighbor(0, 0.2f)), corpus, 0.5);

        assertThat(matches).extracting(MatchResult::getTicketId).containsExactly("C", "A");
    }

    @Test
    void nanSimilarityNeverSurvives() {
        List<MatchResult> matches = ranker.rank(List.of(new IndexNeighbor(0, Float.NaN)), corpus, -1.0);

        assertThat(matches).isEmpty();
    }

    @Test
    void unjoinableSurvivorFailsTheQuery() {
        CorpusSnapshot partial = CorpusSnapshot.attach(List.of("A", "GONE"), List.of(ticket("A", false)));

        assertThat(partial.missingTicketIds()).containsExactly("GONE");
        assertThatThrownBy(() -> ranker.rank(List.of(
                new IndexNeighbor(0, 0.1f),
                new IndexNeighbor(1, 0.2f)), partial, 0.5))
                .isInstanceOf(RecordNotFoundException.class)
                .hasMessageContaining("GONE");
    }

    @Test
    void unjoinableHitBelowThresholdIsIgnored() {
        CorpusSnapshot partial = CorpusSnapshot.attach(List.of("A", "GONE"), List.of(ticket("A", false)));

        List<MatchResult> matches = ranker.rank(List.of(
                new IndexNeighbor(0, 0.1f),
                new IndexNeighbor(1, 0.9f)), partial, 0.5);

        assertThat(matches).extracting(MatchResult::getTicketId).containsExactly("A");
    }

    @Test
    void slotOutsideTableIsNotFound() {
        assertThatThrownBy(() -> corpus.recordForSlot(4)).isInstanceOf(RecordNotFoundException.class);
        assertThatThrownBy(() -> corpus.recordForSlot(-1)).isInstanceOf(RecordNotFoundException.class);
    }

    @Test
    void snapshotRejectsDuplicateAndBlankIds() {
        assertThatThrownBy(() -> CorpusSnapshot.ofBuildOrder(List.of(ticket("A", false), ticket("A", true))))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> CorpusSnapshot.ofBuildOrder(List.of(ticket(" ", false))))
                .isInstanceOf(InvalidArgumentException.class);
    }
}
