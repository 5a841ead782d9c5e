package com.intelhub.backend.exception;

import lombok.Getter;

/**
 * Transport, timeout or rate-limit failure of the AI provider. Always retryable.
 */
@Getter
public class AiProviderException extends RuntimeException {

    private final String provider;

    public AiProviderException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public AiProviderException(String provider, String message) {
        super(message);
        this.provider = provider;
    }
}
