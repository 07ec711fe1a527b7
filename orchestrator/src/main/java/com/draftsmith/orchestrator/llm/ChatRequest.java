package com.draftsmith.orchestrator.llm;

import java.util.List;

/**
 * A chat completion request: the target endpoint, the ordered messages,
 * the sampling temperature and an optional cap on output size.
 */
public record ChatRequest(
        ModelEndpoint     endpoint,
        List<ChatMessage> messages,
        double            temperature,
        Integer           maxTokens
) {
    public ChatRequest {
        messages = List.copyOf(messages);
    }

    public ChatRequest(ModelEndpoint endpoint, List<ChatMessage> messages, double temperature) {
        this(endpoint, messages, temperature, null);
    }
}
