package com.yourname.contentvalidation.exception;

import com.yourname.contentvalidation.model.ProviderId;

/**
 * Raised by provider clients. Never leaves the provider adapter; it is turned into a
 * {@code ProviderResult} failure there.
 */
public class ProviderException extends RuntimeException {

    private final ProviderId provider;
    private final ProviderErrorKind kind;

    public ProviderException(ProviderId provider, ProviderErrorKind kind, String message) {
        super(message);
        this.provider = provider;
        this.kind = kind;
    }

    public ProviderException(ProviderId provider, ProviderErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.kind = kind;
    }

    public ProviderId provider() {
        return provider;
    }

    public ProviderErrorKind kind() {
        return kind;
    }
}
