package com.codeforge.orchestrator.llm;

/**
 * A single message in a conversation.
 * role must be "user" or "assistant"; the system prompt travels separately.
 */
public record Message(String role, String content) {

    public static Message user(String content) {
        return new Message("user", content);
    }

    public static Message assistant(String content) {
        return new Message("assistant", content);
    }
}
