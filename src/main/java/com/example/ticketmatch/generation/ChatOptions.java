package com.example.ticketmatch.generation;

/**
 * Sampling settings for a single chat-completion call.
 */
public record ChatOptions(int maxTokens, double temperature, double topP) {
}
