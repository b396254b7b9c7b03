package com.yourname.contentvalidation.model;

import java.util.List;

public record CombinedCriterion(
    int score,
    int maxPoints,
    double confidence,
    String feedback,
    List<String> issues
) {
    public CombinedCriterion {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
