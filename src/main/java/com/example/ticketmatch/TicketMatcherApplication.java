package com.example.ticketmatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Ticket Matcher - semantic retrieval of past support tickets.
 *
 * Architecture:
 * - Text normalizer + embedding gateway → query vectors
 * - HNSW index → approximate top-k neighbours by cosine distance
 * - Retrieval ranker → similarity threshold, resolved tickets first
 * - Response generator → draft reply from the ranked evidence
 */
@SpringBootApplication
@EnableAsync
public class TicketMatcherApplication {

    public static void main(String[] args) {
        SpringApplication.run(TicketMatcherApplication.class, args);
    }
}
