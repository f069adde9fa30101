package com.example.ticketmatch.controller;

import com.example.ticketmatch.domain.MatchResult;
import com.example.ticketmatch.domain.TicketQuery;
import com.example.ticketmatch.exception.IndexPersistenceException;
import com.example.ticketmatch.exception.IndexStateException;
import com.example.ticketmatch.exception.InvalidArgumentException;
import com.example.ticketmatch.exception.NotInitializedException;
import com.example.ticketmatch.exception.ProviderException;
import com.example.ticketmatch.generation.DraftResponse;
import com.example.ticketmatch.generation.ResponseMode;
import com.example.ticketmatch.generation.TicketResponseGenerator;
import com.example.ticketmatch.matching.IndexBootstrap;
import com.example.ticketmatch.matching.TicketMatcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {TicketController.class, IndexController.class})
class TicketControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TicketMatcher matcher;

    @MockBean
    private TicketResponseGenerator responseGenerator;

    @MockBean
    private IndexBootstrap bootstrap;

    private static final String QUERY_JSON = """
            {"issue": "Printer not connecting to WiFi", "k": 3, "threshold": 0.3}
            """;

    private final MatchResult resolvedMatch = MatchResult.builder()
            .ticketId("T2")
            .similarityScore(0.316)
            .issue("Printer offline")
            .category("")
            .description("")
            .resolved(true)
            .resolution("Reinstall driver")
            .build();

    @Test
    void similarReturnsRankedMatchesInWireFormat() throws Exception {
        when(matcher.findSimilar(any(TicketQuery.class))).thenReturn(List.of(resolvedMatch));

        mockMvc.perform(post("/api/tickets/similar").contentType(MediaType.APPLICATION_JSON).content(QUERY_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].ticket_id").value("T2"))
                .andExpect(jsonPath("$[0].similarity_score").value(0.316))
                .andExpect(jsonPath("$[0].resolved").value(true))
                .andExpect(jsonPath("$[0].resolution").value("Reinstall driver"));
    }

    @Test
    void respondReturnsDraftWithItsEvidence() throws Exception {
        List<MatchResult> matches = List.of(resolvedMatch);
        when(matcher.findSimilar(any(TicketQuery.class))).thenReturn(matches);
        when(responseGenerator.generateResponse(any(TicketQuery.class), eq(matches))).thenReturn(DraftResponse.builder()
                .mode(ResponseMode.RESOLVED_EVIDENCE)
                .matches(matches)
                .response("Please reinstall the driver.")
                .build());

        mockMvc.perform(post("/api/tickets/respond").contentType(MediaType.APPLICATION_JSON).content(QUERY_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("RESOLVED_EVIDENCE"))
                .andExpect(jsonPath("$.matches[0].ticket_id").value("T2"))
                .andExpect(jsonPath("$.response").value("Please reinstall the driver."));
    }

    @Test
    void notReadyMapsToServiceUnavailable() throws Exception {
        when(matcher.findSimilar(any(TicketQuery.class)))
                .thenThrow(new NotInitializedException("Ticket index is not ready"));

        mockMvc.perform(post("/api/tickets/similar").contentType(MediaType.APPLICATION_JSON).content(QUERY_JSON))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("not_initialized"));
    }

    @Test
    void invalidArgumentMapsToBadRequest() throws Exception {
        when(matcher.findSimilar(any(TicketQuery.class)))
                .thenThrow(new InvalidArgumentException("k must be positive, got 0"));

        mockMvc.perform(post("/api/tickets/similar").contentType(MediaType.APPLICATION_JSON).content(QUERY_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_argument"))
                .andExpect(jsonPath("$.message").value("k must be positive, got 0"));
    }

    @Test
    void statusIncludesLastBootstrapError() throws Exception {
        when(matcher.getStatus()).thenReturn(Map.of("state", "UNINITIALIZED"));
        when(bootstrap.getLastError()).thenReturn("Ticket data file not found at data/combined_data.csv");

        mockMvc.perform(get("/api/index/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("UNINITIALIZED"))
                .andExpect(jsonPath("$.lastError").value("Ticket data file not found at data/combined_data.csv"));
    }

    @Test
    void statusKeepsTheMatchersFieldOrder() throws Exception {
        Map<String, Object> ordered = new LinkedHashMap<>();
        ordered.put("state", "READY");
        ordered.put("embeddingModel", "all-MiniLM-L6-v2");
        ordered.put("dimension", 384);
        ordered.put("indexPath", "data/ticket_index.bin");
        ordered.put("corpusPath", "data/combined_data.csv");
        ordered.put("indexSize", 3);
        when(matcher.getStatus()).thenReturn(ordered);
        when(bootstrap.getLastError()).thenReturn("earlier failure");

        String body = mockMvc.perform(get("/api/index/status"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        assertThat(body).containsSubsequence("\"state\"", "\"embeddingModel\"", "\"dimension\"",
                "\"indexPath\"", "\"corpusPath\"", "\"indexSize\"", "\"lastError\"");
    }

    @Test
    void rebuildOfReadyMatcherIsAConflict() throws Exception {
        doThrow(new IndexStateException("Cannot build while matcher is READY"))
                .when(bootstrap).buildFromCorpusFile();

        mockMvc.perform(post("/api/index/build"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("invalid_state"));
    }

    @Test
    void remainingFailuresMapByKind() {
        assertThat(ApiExceptionHandler.statusFor(new ProviderException("down"))).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(ApiExceptionHandler.statusFor(new IndexPersistenceException("corrupt")))
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
