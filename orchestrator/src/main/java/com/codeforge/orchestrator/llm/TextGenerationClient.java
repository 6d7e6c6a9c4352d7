package com.codeforge.orchestrator.llm;

import java.util.List;

/**
 * The external text-generation collaborator, seen from the orchestrator.
 *
 * Implementations perform exactly one request per call; timeouts and retries
 * are layered on by {@link ResilientTextGenerator}.
 */
public interface TextGenerationClient {

    /**
     * @param model        provider-specific model name
     * @param messages     conversation so far, alternating user and assistant
     * @param systemPrompt stage instructions
     * @return the assistant's text reply
     * @throws ExternalServiceException if the service is unreachable or answers with an error
     */
    String complete(String model, List<Message> messages, String systemPrompt);
}
