package com.yourname.contentvalidation.model;

import java.util.Map;

public record CombinedScore(
    Map<String, CombinedCriterion> finalScore,
    Map<String, String> finalFeedback,
    int overallScore,
    double overallConfidence
) {}
