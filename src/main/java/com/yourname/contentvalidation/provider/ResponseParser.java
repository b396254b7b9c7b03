package com.yourname.contentvalidation.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yourname.contentvalidation.model.CriterionScore;
import com.yourname.contentvalidation.model.DetailedFeedback;
import com.yourname.contentvalidation.model.ProviderId;
import com.yourname.contentvalidation.model.RubricSpec;
import com.yourname.contentvalidation.model.ValidationOutput;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns free-text model output into a {@link ValidationOutput} for a given rubric. The response is
 * untrusted: missing keys are rejected, out-of-range scores are clamped with a warning, and the
 * overall score is recomputed from the breakdown.
 */
@Component
public class ResponseParser {

    private static final List<String> SUSPICIOUS_FEEDBACK = List.of(
        "ignore previous", "disregard previous", "manipulated", "hacked",
        "exploited", "bypassed", "tricked", "jailbreak", "prompt injection"
    );

    private final ObjectMapper objectMapper;
    private final boolean rejectPerfectScores;

    public ResponseParser(
        ObjectMapper objectMapper,
        @Value("${validation.guard.reject-perfect-scores:true}") boolean rejectPerfectScores
    ) {
        this.objectMapper = objectMapper;
        this.rejectPerfectScores = rejectPerfectScores;
    }

    public ParseResult parse(ProviderId provider, String raw, RubricSpec rubric) {
        String trimmed = raw == null ? "" : raw.trim();
        String json = extractJsonObject(trimmed);
        String unfenced = extractJsonObject(normalizeJson(trimmed));
        if (json.isEmpty() && unfenced.isEmpty()) {
            return ParseResult.failure("Empty response");
        }

        // Fence markers may appear inside string values, so a failed unwrap falls back to the whole object.
        boolean fenced = trimmed.startsWith("```") || json.isEmpty();
        String primary = fenced ? unfenced : json;
        String secondary = fenced ? json : unfenced;
        JsonNode root;
        try {
            root = readWithFallback(primary);
        } catch (JsonProcessingException e) {
            if (secondary.isEmpty() || secondary.equals(primary)) {
                return ParseResult.failure("Malformed JSON: " + e.getOriginalMessage());
            }
            try {
                root = readWithFallback(secondary);
            } catch (JsonProcessingException retryError) {
                return ParseResult.failure("Malformed JSON: " + e.getOriginalMessage());
            }
        }
        if (root == null || !root.isObject()) {
            return ParseResult.failure("Response is not a JSON object");
        }

        JsonNode overall = root.get("overallScore");
        if (overall == null || !overall.isNumber()) {
            return ParseResult.failure("Missing or non-numeric overallScore");
        }
        JsonNode breakdown = root.get("scoreBreakdown");
        if (breakdown == null || !breakdown.isObject()) {
            return ParseResult.failure("Missing scoreBreakdown object");
        }
        JsonNode feedback = root.get("detailedFeedback");
        if (feedback == null || !feedback.isObject()) {
            return ParseResult.failure("Missing detailedFeedback object");
        }

        List<String> warnings = new ArrayList<>();
        Map<String, CriterionScore> scores = new LinkedHashMap<>();

        for (RubricSpec.Criterion criterion : rubric.criteria()) {
            JsonNode entry = breakdown.get(criterion.key());
            if (entry == null || !entry.isObject()) {
                return ParseResult.failure("scoreBreakdown is missing criterion " + criterion.key());
            }
            JsonNode score = entry.get("score");
            if (score == null || !score.isNumber()) {
                return ParseResult.failure("Criterion " + criterion.key() + " has no numeric score");
            }
            JsonNode explanation = entry.get("explanation");
            if (explanation == null || !explanation.isTextual()) {
                return ParseResult.failure("Criterion " + criterion.key() + " has no explanation");
            }

            long rounded = Math.round(score.asDouble());
            int clamped = (int) Math.max(0, Math.min(criterion.maxPoints(), rounded));
            if (clamped != rounded) {
                warnings.add("Clamped " + criterion.key() + " from " + score.asText() + " to " + clamped);
            }
            scores.put(criterion.key(), new CriterionScore(clamped, explanation.asText()));
        }

        Iterator<String> names = breakdown.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (rubric.criterion(name).isEmpty()) {
                warnings.add("Ignored unknown criterion " + name);
            }
        }

        List<String> strengths = readStrings(feedback.get("strengths"));
        List<String> weaknesses = readStrings(feedback.get("weaknesses"));
        JsonNode suggestion = feedback.get("suggestion");
        if (strengths == null || weaknesses == null || suggestion == null || !suggestion.isTextual()) {
            return ParseResult.failure("detailedFeedback needs strengths, weaknesses and suggestion");
        }

        int sum = scores.values().stream().mapToInt(CriterionScore::score).sum();
        if (Math.round(overall.asDouble()) != sum) {
            warnings.add("Reported overallScore " + overall.asText() + " replaced by criterion sum " + sum);
        }

        DetailedFeedback detailed = new DetailedFeedback(strengths, weaknesses, suggestion.asText());
        String rejection = guard(rubric, scores, detailed);
        if (rejection != null) {
            return ParseResult.failure(rejection);
        }

        return ParseResult.success(new ValidationOutput(provider, false, sum, scores, detailed, warnings, null));
    }

    // -------------------------------------------------------------------------
    // Guard
    // -------------------------------------------------------------------------

    private String guard(RubricSpec rubric, Map<String, CriterionScore> scores, DetailedFeedback feedback) {
        StringBuilder text = new StringBuilder();
        scores.values().forEach(s -> text.append(s.explanation()).append(' '));
        feedback.strengths().forEach(s -> text.append(s).append(' '));
        feedback.weaknesses().forEach(s -> text.append(s).append(' '));
        text.append(feedback.suggestion());
        String lower = text.toString().toLowerCase(Locale.ROOT);
        for (String term : SUSPICIOUS_FEEDBACK) {
            if (lower.contains(term)) {
                return "Response contains suspicious content: " + term;
            }
        }

        if (rejectPerfectScores) {
            boolean allPerfect = rubric.criteria().stream()
                .allMatch(c -> scores.get(c.key()).score() == c.maxPoints());
            if (allPerfect) {
                return "Suspiciously perfect scores detected";
            }
        }
        return null;
    }

    // -------------------------------------------------------------------------
    // JSON utilities
    // -------------------------------------------------------------------------

    private JsonNode readWithFallback(String json) throws JsonProcessingException {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return lenientMapper().readTree(json);
        }
    }

    private ObjectMapper lenientMapper() {
        return objectMapper.copy()
            .configure(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS.mappedFeature(), true)
            .configure(JsonReadFeature.ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER.mappedFeature(), true)
            .configure(JsonReadFeature.ALLOW_SINGLE_QUOTES.mappedFeature(), true)
            .configure(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature(), true);
    }

    private static List<String> readStrings(JsonNode node) {
        if (node == null || !node.isArray()) return null;
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) return null;
            values.add(item.asText());
        }
        return values;
    }

    /** Unwraps the first fenced block, wherever it sits in the response. Used only when the raw text does not parse. */
    static String normalizeJson(String content) {
        String trimmed = content == null ? "" : content.trim();
        int open = trimmed.indexOf("```");
        if (open >= 0) {
            int firstNewline = trimmed.indexOf('\n', open);
            int close = firstNewline < 0 ? -1 : trimmed.indexOf("```", firstNewline);
            if (firstNewline > 0 && close > firstNewline) {
                return trimmed.substring(firstNewline + 1, close).trim();
            }
        }
        return trimmed;
    }

    static String extractJsonObject(String content) {
        if (content == null) return "";
        String trimmed = content.trim();
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) return trimmed;
        int first = trimmed.indexOf('{');
        int last = trimmed.lastIndexOf('}');
        return (first >= 0 && last > first) ? trimmed.substring(first, last + 1).trim() : trimmed;
    }
}
