package com.codeforge.orchestrator.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Provides the raw client for each {@link Provider}. API keys come from the
 * environment through Spring placeholders and are never logged.
 */
@Component
public class TextGenerationClients {

    private final Map<Provider, TextGenerationClient> clients = new EnumMap<>(Provider.class);

    public TextGenerationClients(
            ObjectMapper objectMapper,
            @Value("${codeforge.llm.anthropic.api-key:}") String anthropicKey,
            @Value("${codeforge.llm.anthropic.base-url:https://api.anthropic.com}") String anthropicUrl,
            @Value("${codeforge.llm.openai.api-key:}") String openAiKey,
            @Value("${codeforge.llm.openai.base-url:https://api.openai.com/v1}") String openAiUrl,
            @Value("${codeforge.llm.groq.api-key:}") String groqKey,
            @Value("${codeforge.llm.groq.base-url:https://api.groq.com/openai/v1}") String groqUrl) {
        clients.put(Provider.ANTHROPIC, new ClaudeClient(anthropicKey, anthropicUrl, objectMapper));
        clients.put(Provider.OPENAI, new OpenAiCompatibleClient("OpenAI", openAiKey, openAiUrl, objectMapper));
        clients.put(Provider.GROQ, new OpenAiCompatibleClient("Groq", groqKey, groqUrl, objectMapper));
    }

    public TextGenerationClient forProvider(Provider provider) {
        return clients.get(provider);
    }
}
