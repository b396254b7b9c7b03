package com.yourname.contentvalidation.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Final outcome of one validation request. {@code providers} lists only the providers whose
 * round-2 verdict was genuine; an empty set means every score is stub-derived.
 */
public record DualValidationResult(
    ContentType contentType,
    RoundResults round1Results,
    RoundResults round2Results,
    Map<String, CombinedCriterion> finalScore,
    Map<String, String> finalFeedback,
    int overallScore,
    double overallConfidence,
    Set<ProviderId> providers,
    long processingTimeMs,
    PreprocessingReport preprocessing
) {
    public DualValidationResult {
        finalScore = Collections.unmodifiableMap(new LinkedHashMap<>(finalScore));
        finalFeedback = Collections.unmodifiableMap(new LinkedHashMap<>(finalFeedback));
        providers = providers.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(providers));
    }
}
