package com.draftsmith.orchestrator.llm;

/**
 * The language-model collaborator the pipeline depends on.
 *
 * Implementations send one chat completion request and return the text
 * content of the first returned choice. Every failure (network error,
 * non-success status, response without content) must surface as a
 * {@link StageCallFailedException} with a human-readable message.
 *
 * The deploying application provides the implementation as a Spring bean.
 */
public interface ChatModelClient {

    String complete(ChatRequest request);
}
