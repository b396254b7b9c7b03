package com.yourname.contentvalidation.exception;

public enum ProviderErrorKind {
    /** No usable credential or endpoint. Permanent. */
    CONFIGURATION(false),
    /** Call exceeded its time budget. */
    TIMEOUT(true),
    /** Response did not satisfy the verdict schema. */
    PARSE(false),
    /** Network or upstream HTTP failure. */
    TRANSPORT(true);

    private final boolean retryable;

    ProviderErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
