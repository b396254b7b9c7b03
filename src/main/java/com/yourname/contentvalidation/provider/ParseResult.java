package com.yourname.contentvalidation.provider;

import com.yourname.contentvalidation.model.ValidationOutput;

/**
 * Outcome of reading a provider response: exactly one of {@code output} and {@code error} is set.
 */
public record ParseResult(ValidationOutput output, String error) {

    public static ParseResult success(ValidationOutput output) {
        return new ParseResult(output, null);
    }

    public static ParseResult failure(String error) {
        return new ParseResult(null, error);
    }

    public boolean isSuccess() {
        return output != null;
    }
}
