package com.yourname.contentvalidation.provider;

import com.yourname.contentvalidation.exception.ProviderErrorKind;
import com.yourname.contentvalidation.model.ProviderId;
import com.yourname.contentvalidation.model.ValidationOutput;

/**
 * Result of one provider invocation: a genuine verdict, or the kind of failure that prevented one.
 */
public record ProviderResult(
    ProviderId provider,
    ValidationOutput output,
    ProviderErrorKind errorKind,
    String errorMessage
) {
    public static ProviderResult success(ValidationOutput output) {
        return new ProviderResult(output.provider(), output, null, null);
    }

    public static ProviderResult failure(ProviderId provider, ProviderErrorKind kind, String message) {
        return new ProviderResult(provider, null, kind, message);
    }

    public boolean isSuccess() {
        return output != null;
    }
}
