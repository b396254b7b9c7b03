package com.yourname.contentvalidation.model;

/**
 * Identifies a scoring source. {@link #LOCAL} is the deterministic stub and never
 * counts as a genuine verdict.
 */
public enum ProviderId {
    OPENAI,
    GEMINI,
    LOCAL
}
