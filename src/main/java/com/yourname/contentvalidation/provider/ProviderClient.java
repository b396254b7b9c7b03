package com.yourname.contentvalidation.provider;

import com.yourname.contentvalidation.model.ProviderId;

/**
 * Raw text-completion transport for one provider. Implementations throw
 * {@link com.yourname.contentvalidation.exception.ProviderException} for every failure.
 */
public interface ProviderClient {

    ProviderId id();

    /** False when no credential or endpoint is configured; the client is then never called. */
    boolean isConfigured();

    String complete(String prompt);
}
