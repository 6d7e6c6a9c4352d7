package com.codeforge.orchestrator.llm;

import java.util.Locale;

/**
 * Text-generation backends a run can be pointed at.
 * OPENAI and GROQ share the chat-completions wire format.
 */
public enum Provider {

    ANTHROPIC("claude-sonnet-4-5"),
    OPENAI("gpt-4o"),
    GROQ("llama-3.3-70b-versatile");

    private final String defaultModel;

    Provider(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public String defaultModel() {
        return defaultModel;
    }

    /** Case-insensitive lookup, as used for CLI flags and configuration values. */
    public static Provider parse(String value) {
        try {
            return Provider.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown provider '" + value + "'; expected one of anthropic, openai, groq", e);
        }
    }
}
