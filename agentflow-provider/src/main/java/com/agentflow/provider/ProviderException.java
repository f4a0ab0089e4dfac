package com.agentflow.provider;

/**
 * Exception thrown by capability providers on failure.
 */
public class ProviderException extends Exception {

    private final String errorCode;
    private final boolean retryable;
    private final long tokensUsed;

    public ProviderException(String errorCode, String message) {
        this(errorCode, message, null, true, 0);
    }

    public ProviderException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, true, 0);
    }

    public ProviderException(String errorCode, String message, Throwable cause, boolean retryable, long tokensUsed) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
        this.tokensUsed = tokensUsed;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Tokens consumed by the failed attempt; still charged to the context.
     */
    public long getTokensUsed() {
        return tokensUsed;
    }

    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static ProviderException permanent(String errorCode, String message) {
        return new ProviderException(errorCode, message, null, false, 0);
    }

    /**
     * Create a retryable exception (transient failure).
     */
    public static ProviderException retryable(String errorCode, String message) {
        return new ProviderException(errorCode, message, null, true, 0);
    }
}
