package com.example.ticketmatch.controller;

import com.example.ticketmatch.matching.IndexBootstrap;
import com.example.ticketmatch.matching.TicketMatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API for index status and on-demand builds.
 */
@RestController
@RequestMapping("/api/index")
@RequiredArgsConstructor
public class IndexController {

    private final TicketMatcher matcher;
    private final IndexBootstrap bootstrap;

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>(matcher.getStatus());
        if (bootstrap.getLastError() != null) {
            status.put("lastError", bootstrap.getLastError());
        }
        return ResponseEntity.ok(status);
    }

    /**
     * Builds the index from the configured corpus file. Only valid while the
     * matcher is uninitialized; rebuilding a ready matcher needs a restart.
     */
    @PostMapping("/build")
    public ResponseEntity<Map<String, Object>> build() {
        bootstrap.buildFromCorpusFile();
        return ResponseEntity.ok(matcher.getStatus());
    }
}
