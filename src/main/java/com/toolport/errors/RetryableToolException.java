package com.toolport.errors;

/**
 * Tells the orchestrator to ask the model again, optionally after
 * {@code retryAfterMs} and with {@code additionalPromptContent} appended.
 */
public class RetryableToolException extends ToolExecutionException {

    private final String additionalPromptContent;
    private final Long retryAfterMs;

    public RetryableToolException(String message) {
        this(message, null, null, null);
    }

    public RetryableToolException(String message, String additionalPromptContent) {
        this(message, null, additionalPromptContent, null);
    }

    public RetryableToolException(String message, String developerMessage,
                                  String additionalPromptContent, Long retryAfterMs) {
        super(message, developerMessage);
        this.additionalPromptContent = additionalPromptContent;
        this.retryAfterMs = retryAfterMs;
    }

    public String additionalPromptContent() {
        return additionalPromptContent;
    }

    public Long retryAfterMs() {
        return retryAfterMs;
    }

    @Override
    public boolean canRetry() {
        return true;
    }
}
