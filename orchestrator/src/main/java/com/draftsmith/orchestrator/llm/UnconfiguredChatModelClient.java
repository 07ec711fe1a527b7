package com.draftsmith.orchestrator.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback used when no {@link ChatModelClient} bean is present.
 * Every call fails, so jobs end up {@code failed} with a clear message
 * instead of the application refusing to start.
 */
public class UnconfiguredChatModelClient implements ChatModelClient {

    private static final Logger log = LoggerFactory.getLogger(UnconfiguredChatModelClient.class);

    @Override
    public String complete(ChatRequest request) {
        log.warn("Chat completion requested for {} but no ChatModelClient is configured", request.endpoint());
        throw new StageCallFailedException(StageCallFailedException.Kind.NOT_CONFIGURED,
                "No language-model client is configured");
    }
}
