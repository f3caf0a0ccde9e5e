package com.causescore.scoring.llm;

/**
 * Chat-completion provider used for qualitative assessment.
 */
public interface LlmClient {

    /**
     * Returns the assistant message text.
     *
     * @throws LlmException on transport failure, timeout, rate-limit timeout or an empty response
     */
    String complete(String systemPrompt, String userPrompt, CompletionOptions options);
}
