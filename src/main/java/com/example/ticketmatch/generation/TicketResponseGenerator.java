package com.example.ticketmatch.generation;

import com.example.ticketmatch.config.MatcherProperties;
import com.example.ticketmatch.domain.MatchResult;
import com.example.ticketmatch.domain.TicketQuery;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Drafts a reply to a new ticket from the ranked matches, for a human agent
 * to review before sending.
 * <p>
 * The prompt depends on {@link ResponseMode}; every draft ends with the
 * configured sign-off line.
 */
@Slf4j
@Service
public class TicketResponseGenerator {

    static final String NO_SOLUTION = "No immediate solution available.";

    private static final String NO_EVIDENCE_PROMPT =
            "You are a technical support assistant. Suggest a solution for the following issue in at most "
                    + "15 words, and ONLY if you are highly confident. If you are not, reply exactly with '"
                    + NO_SOLUTION + "'";

    private static final ChatOptions NO_EVIDENCE_OPTIONS = new ChatOptions(50, 0.1, 0.1);

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final MatcherProperties.GenerationConfig config;

    public TicketResponseGenerator(ChatClient chatClient, ObjectMapper objectMapper, MatcherProperties properties) {
        this.chatClient = chatClient;
        this.objectMapper = objectMapper;
        this.config = properties.getGeneration();
    }

    public DraftResponse generateResponse(TicketQuery ticket, List<MatchResult> matches) {
        ResponseMode mode = ResponseMode.of(matches);
        String ticketJson = toJson(newTicketView(ticket));

        String text = switch (mode) {
            case NO_EVIDENCE -> draftWithoutEvidence(ticketJson);
            case RESOLVED_EVIDENCE -> draftFromEvidence(
                    resolvedEvidencePrompt(matches.stream().filter(MatchResult::isResolved).collect(Collectors.toList())),
                    ticketJson);
            case UNRESOLVED_EVIDENCE -> draftFromEvidence(unresolvedEvidencePrompt(matches), ticketJson);
        };

        log.debug("Drafted {} response ({} chars) from {} matches", mode, text.length(),
                matches == null ? 0 : matches.size());
        return DraftResponse.builder()
                .mode(mode)
                .matches(matches == null ? List.of() : matches)
                .response(text)
                .build();
    }

    // ── Modes ──

    private String draftWithoutEvidence(String ticketJson) {
        String suggestion = chatClient.chat(List.of(
                ChatMessage.system(NO_EVIDENCE_PROMPT),
                ChatMessage.user("Issue: " + ticketJson)
        ), NO_EVIDENCE_OPTIONS);
        return withSignOff("No matching tickets found in the database.\n\nSuggested direction: " + suggestion.strip());
    }

    private String draftFromEvidence(String systemPrompt, String ticketJson) {
        String generated = chatClient.chat(List.of(
                ChatMessage.system(systemPrompt),
                ChatMessage.user("New Ticket: " + ticketJson)
        ), new ChatOptions(config.getMaxTokens(), config.getTemperature(), config.getTopP()));
        return withSignOff(generated);
    }

    String resolvedEvidencePrompt(List<MatchResult> resolved) {
        return """
                You are an AI assistant that helps human agents answer support tickets.

                You will receive a new support ticket together with %d similar tickets from our history \
                that were resolved.

                Your task:
                1. Read the new ticket and the resolved tickets below.
                2. Write a coherent reply that addresses the new ticket's issue.
                3. Include the most relevant solution from the resolved tickets.
                4. End the message with: %s

                Resolved similar tickets:
                %s

                Be concise but complete.
                """.formatted(resolved.size(), config.getSignOff(), toJson(resolved));
    }

    String unresolvedEvidencePrompt(List<MatchResult> matches) {
        return """
                You are an AI assistant that helps human agents answer support tickets.

                You will receive a new support ticket together with %d similar tickets from our history. \
                None of them has been resolved.

                Your task:
                1. Read the new ticket and the unresolved tickets below.
                2. Write a reply that acknowledges this is an ongoing issue.
                3. Summarize the similar tickets and which approaches did not work.
                4. Suggest next steps based on that history.
                5. Make the reply ready for a human agent to review and send.
                6. End the message with: %s

                Unresolved similar tickets:
                %s

                Make clear that there is no proven solution yet.
                """.formatted(matches.size(), config.getSignOff(), toJson(matches));
    }

    // ── Helpers ──

    String withSignOff(String text) {
        String body = text == null ? "" : text.strip();
        if (body.endsWith(config.getSignOff())) {
            return body;
        }
        return body.isEmpty() ? config.getSignOff() : body + "\n\n" + config.getSignOff();
    }

    private static Map<String, String> newTicketView(TicketQuery ticket) {
        Map<String, String> view = new LinkedHashMap<>();
        view.put("Issue", ticket.getIssue() == null ? "" : ticket.getIssue());
        view.put("Category", ticket.getCategory() == null ? "" : ticket.getCategory());
        view.put("Description", ticket.getDescription() == null ? "" : ticket.getDescription());
        return view;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize prompt context", e);
        }
    }
}
