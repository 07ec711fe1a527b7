package com.draftsmith.orchestrator.llm;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A single role-tagged message in a chat completion request.
 * role is one of "system", "user" or "assistant".
 */
public record ChatMessage(String role, String content) {

    public static final String SYSTEM    = "system";
    public static final String USER      = "user";
    public static final String ASSISTANT = "assistant";

    public static ChatMessage system(String content)    { return new ChatMessage(SYSTEM, content); }
    public static ChatMessage user(String content)      { return new ChatMessage(USER, content); }
    public static ChatMessage assistant(String content) { return new ChatMessage(ASSISTANT, content); }

    @JsonIgnore
    public boolean isSystem()    { return SYSTEM.equals(role); }
    @JsonIgnore
    public boolean isAssistant() { return ASSISTANT.equals(role); }
}
