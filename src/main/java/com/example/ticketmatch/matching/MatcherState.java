package com.example.ticketmatch.matching;

/**
 * Lifecycle of {@link TicketMatcher}. There is no way back from {@link #READY}.
 */
public enum MatcherState {
    UNINITIALIZED,
    /** A build, load or attach is running */
    INITIALIZING,
    /** Index and slot table loaded, waiting for the corpus */
    INDEX_LOADED,
    READY
}
