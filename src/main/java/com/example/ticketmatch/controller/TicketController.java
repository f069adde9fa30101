package com.example.ticketmatch.controller;

import com.example.ticketmatch.domain.MatchResult;
import com.example.ticketmatch.domain.TicketQuery;
import com.example.ticketmatch.generation.DraftResponse;
import com.example.ticketmatch.generation.TicketResponseGenerator;
import com.example.ticketmatch.matching.TicketMatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Similar-ticket search and reply drafting.
 */
@RestController
@RequestMapping("/api/tickets")
@RequiredArgsConstructor
public class TicketController {

    private final TicketMatcher matcher;
    private final TicketResponseGenerator responseGenerator;

    /**
     * Ranked matches for a new ticket: resolved first, then by similarity.
     */
    @PostMapping("/similar")
    public ResponseEntity<List<MatchResult>> findSimilar(@RequestBody TicketQuery query) {
        return ResponseEntity.ok(matcher.findSimilar(query));
    }

    /**
     * Ranked matches plus a drafted reply built from them.
     */
    @PostMapping("/respond")
    public ResponseEntity<DraftResponse> respond(@RequestBody TicketQuery query) {
        List<MatchResult> matches = matcher.findSimilar(query);
        return ResponseEntity.ok(responseGenerator.generateResponse(query, matches));
    }
}
