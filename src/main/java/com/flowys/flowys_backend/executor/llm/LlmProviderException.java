package com.flowys.flowys_backend.executor.llm;

/**
 * Provider failure that retrying cannot fix: bad or missing key, forbidden, rate limit, quota,
 * or a cancelled call. Propagates out of the retry loop immediately.
 */
public class LlmProviderException extends RuntimeException {

    private final int statusCode;

    public LlmProviderException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
