package com.yourname.contentvalidation.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One provider's verdict for one round. {@code stub} marks a substituted placeholder verdict;
 * {@code fallbackReason} says why the substitution happened and is null for genuine verdicts.
 */
public record ValidationOutput(
    ProviderId provider,
    boolean stub,
    int overallScore,
    Map<String, CriterionScore> scoreBreakdown,
    DetailedFeedback detailedFeedback,
    List<String> warnings,
    String fallbackReason
) {
    public ValidationOutput {
        scoreBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(scoreBreakdown));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean genuine() {
        return !stub;
    }

    public CriterionScore criterion(String key) {
        return scoreBreakdown.get(key);
    }

    /** Same verdict re-labelled as a stand-in for {@code asked}, with the reason it was needed. */
    public ValidationOutput substitutedFor(ProviderId asked, String reason) {
        return new ValidationOutput(asked, true, overallScore, scoreBreakdown, detailedFeedback, warnings, reason);
    }
}
