package com.causescore.scoring.llm;

/**
 * @param jsonMode ask the provider for a JSON object response
 */
public record CompletionOptions(double temperature, int maxTokens, boolean jsonMode) {
}
