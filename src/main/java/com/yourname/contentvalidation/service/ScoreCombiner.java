package com.yourname.contentvalidation.service;

import com.yourname.contentvalidation.model.CombinedCriterion;
import com.yourname.contentvalidation.model.CombinedScore;
import com.yourname.contentvalidation.model.CriterionScore;
import com.yourname.contentvalidation.model.RoundResults;
import com.yourname.contentvalidation.model.RubricSpec;
import com.yourname.contentvalidation.model.ValidationOutput;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Merges the two round-2 verdicts per criterion.
 *
 * <p>Two genuine verdicts: score is the rounded mean, confidence is
 * {@code 1 - |a - b| / maxPoints} clamped to [0, 1]. One genuine verdict: its score is used as-is
 * and confidence drops to the single-source value. Two stubs: stub score, confidence 0.
 */
@Component
public class ScoreCombiner {

    private final double agreementTolerance;
    private final double singleSourceConfidence;

    public ScoreCombiner(
        @Value("${validation.combiner.agreement-tolerance:0.10}") double agreementTolerance,
        @Value("${validation.combiner.single-source-confidence:0.5}") double singleSourceConfidence
    ) {
        this.agreementTolerance = agreementTolerance;
        this.singleSourceConfidence = singleSourceConfidence;
    }

    public CombinedScore combine(RubricSpec rubric, RoundResults round2) {
        ValidationOutput a = round2.providerA();
        ValidationOutput b = round2.providerB();

        Map<String, CombinedCriterion> finalScore = new LinkedHashMap<>();
        Map<String, String> finalFeedback = new LinkedHashMap<>();
        int overall = 0;
        double confidenceSum = 0;

        for (RubricSpec.Criterion criterion : rubric.criteria()) {
            CombinedCriterion combined = combineCriterion(criterion, a, b);
            finalScore.put(criterion.key(), combined);
            finalFeedback.put(criterion.key(), combined.feedback());
            overall += combined.score();
            confidenceSum += combined.confidence();
        }

        double overallConfidence = Math.round(confidenceSum / rubric.criteria().size() * 100) / 100.0;
        return new CombinedScore(finalScore, finalFeedback, overall, overallConfidence);
    }

    // -------------------------------------------------------------------------

    private CombinedCriterion combineCriterion(RubricSpec.Criterion criterion, ValidationOutput a, ValidationOutput b) {
        int max = criterion.maxPoints();
        CriterionScore scoreA = a.criterion(criterion.key());
        CriterionScore scoreB = b.criterion(criterion.key());

        if (a.genuine() != b.genuine()) {
            ValidationOutput sole = a.genuine() ? a : b;
            ValidationOutput missing = a.genuine() ? b : a;
            CriterionScore score = a.genuine() ? scoreA : scoreB;
            return new CombinedCriterion(score.score(), max, singleSourceConfidence, score.explanation(),
                List.of("Single-source score: " + missing.provider() + " unavailable ("
                    + missing.fallbackReason() + "), scored by " + sole.provider() + " only"));
        }

        int diff = Math.abs(scoreA.score() - scoreB.score());
        int score = (int) Math.round((scoreA.score() + scoreB.score()) / 2.0);
        boolean agree = diff <= agreementTolerance * max;

        List<String> issues = new ArrayList<>();
        String feedback;
        if (agree) {
            feedback = scoreA.explanation().isBlank() ? scoreB.explanation() : scoreA.explanation();
        } else {
            feedback = a.provider() + ": " + scoreA.explanation() + " | " + b.provider() + ": " + scoreB.explanation();
            issues.add("Providers diverged by " + diff + " of " + max + " points ("
                + a.provider() + "=" + scoreA.score() + ", " + b.provider() + "=" + scoreB.score() + ")");
        }

        double confidence;
        if (a.stub()) {
            confidence = 0.0;
            issues.add("No genuine provider verdict; stub score only");
        } else {
            confidence = Math.max(0.0, Math.min(1.0, 1.0 - diff / (double) max));
        }

        return new CombinedCriterion(score, max, confidence, feedback, issues);
    }
}
