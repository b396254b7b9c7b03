package com.yourname.contentvalidation.provider;

import com.yourname.contentvalidation.model.CriterionScore;
import com.yourname.contentvalidation.model.DetailedFeedback;
import com.yourname.contentvalidation.model.ProviderId;
import com.yourname.contentvalidation.model.RubricSpec;
import com.yourname.contentvalidation.model.ValidationOutput;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * The LOCAL provider: a placeholder verdict computed from content length and markdown structure
 * alone. Same content and rubric always give the same verdict, and no network is involved.
 */
@Component
public class StubProvider {

    static final String LABEL = "[Stub verdict] AI validation unavailable";

    private static final int FULL_LENGTH_CHARS = 1_500;
    private static final double BASE_FRACTION = 0.15;
    private static final double LENGTH_WEIGHT = 0.45;
    private static final double MAX_FRACTION = 0.85;

    private static final Pattern HEADER = Pattern.compile("(?m)^#+\\s");
    private static final Pattern LIST_ITEM = Pattern.compile("(?m)^\\s*([*+-]|\\d+\\.)\\s");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");

    public ValidationOutput verdict(String content, RubricSpec rubric) {
        String text = content == null ? "" : content.strip();

        boolean hasHeaders = HEADER.matcher(text).find();
        boolean hasLists = LIST_ITEM.matcher(text).find();
        boolean hasCode = text.contains("```");
        boolean hasParagraphs = PARAGRAPH_BREAK.split(text).length >= 3;

        double fraction = BASE_FRACTION + LENGTH_WEIGHT * Math.min(1.0, text.length() / (double) FULL_LENGTH_CHARS);
        if (hasHeaders) fraction += 0.15;
        if (hasLists) fraction += 0.10;
        if (hasCode) fraction += 0.05;
        if (hasParagraphs) fraction += 0.10;
        fraction = Math.min(MAX_FRACTION, fraction);

        Map<String, CriterionScore> breakdown = new LinkedHashMap<>();
        int total = 0;
        for (RubricSpec.Criterion criterion : rubric.criteria()) {
            int score = (int) Math.round(criterion.maxPoints() * fraction);
            total += score;
            breakdown.put(criterion.key(), new CriterionScore(score,
                LABEL + " - placeholder " + criterion.label().toLowerCase(Locale.ROOT)
                    + " score estimated from content length and structure"));
        }

        List<String> strengths = new ArrayList<>();
        List<String> weaknesses = new ArrayList<>();
        if (hasHeaders) strengths.add("Uses headers to organize content");
        else weaknesses.add("No headers found");
        if (hasLists) strengths.add("Uses lists for scannable points");
        else weaknesses.add("No lists found");
        if (hasParagraphs) strengths.add("Content is broken into several paragraphs");
        else weaknesses.add("Content is not broken into paragraphs");
        if (text.length() < 50) {
            weaknesses.add("Content is very short");
        }

        DetailedFeedback feedback = new DetailedFeedback(strengths, weaknesses,
            LABEL + " - please ensure the content covers the required topic comprehensively with clear structure");

        return new ValidationOutput(ProviderId.LOCAL, true, total, breakdown, feedback, List.of(), null);
    }
}
