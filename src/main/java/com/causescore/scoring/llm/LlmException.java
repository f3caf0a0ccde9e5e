package com.causescore.scoring.llm;

/**
 * Text-generation call failed or returned no usable content.
 */
public class LlmException extends RuntimeException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
