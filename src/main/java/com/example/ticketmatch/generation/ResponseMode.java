package com.example.ticketmatch.generation;

import com.example.ticketmatch.domain.MatchResult;

import java.util.List;

/**
 * How a reply is drafted, chosen from the evidence the matcher returned.
 */
public enum ResponseMode {
    /** At least one match is resolved: present the best resolution */
    RESOLVED_EVIDENCE,
    /** Matches exist but none is resolved: acknowledge and propose next steps */
    UNRESOLVED_EVIDENCE,
    /** Nothing cleared the threshold */
    NO_EVIDENCE;

    public static ResponseMode of(List<MatchResult> matches) {
        if (matches == null || matches.isEmpty()) return NO_EVIDENCE;
        return matches.stream().anyMatch(MatchResult::isResolved) ? RESOLVED_EVIDENCE : UNRESOLVED_EVIDENCE;
    }
}
