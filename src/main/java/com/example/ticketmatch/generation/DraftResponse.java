package com.example.ticketmatch.generation;

import com.example.ticketmatch.domain.MatchResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftResponse {

    private ResponseMode mode;
    private List<MatchResult> matches;
    private String response;
}
