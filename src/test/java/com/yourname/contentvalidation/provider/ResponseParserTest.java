package com.yourname.contentvalidation.provider;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yourname.contentvalidation.model.ContentType;
import com.yourname.contentvalidation.model.ProviderId;
import com.yourname.contentvalidation.model.RubricSpec;
import com.yourname.contentvalidation.model.ValidationOutput;
import com.yourname.contentvalidation.support.VerdictJson;
import org.junit.jupiter.api.Test;

class ResponseParserTest {

    private final ResponseParser parser = new ResponseParser(new ObjectMapper(), true);
    private final RubricSpec lecture = RubricSpec.of(ContentType.LECTURE_NOTE);

    @Test
    void parsesWellFormedVerdict() {
        ParseResult result = parser.parse(ProviderId.OPENAI, VerdictJson.of(lecture, 0.8, "Good"), lecture);

        assertThat(result.isSuccess()).isTrue();
        ValidationOutput output = result.output();
        assertThat(output.provider()).isEqualTo(ProviderId.OPENAI);
        assertThat(output.stub()).isFalse();
        assertThat(output.scoreBreakdown()).containsOnlyKeys(lecture.keys());
        assertThat(output.criterion("contentStructure").score()).isEqualTo(16);
        assertThat(output.overallScore())
            .isEqualTo(output.scoreBreakdown().values().stream().mapToInt(s -> s.score()).sum());
        assertThat(output.warnings()).isEmpty();
    }

    @Test
    void unwrapsFencedJsonSurroundedByProse() {
        String raw = "Here is my assessment:\n```json\n" + VerdictJson.of(lecture, 0.5, "Fine") + "\n```\nThanks!";

        assertThat(parser.parse(ProviderId.GEMINI, raw, lecture).isSuccess()).isTrue();
    }

    @Test
    void rejectsMalformedJson() {
        ParseResult result = parser.parse(ProviderId.OPENAI, "{\"overallScore\": 50, \"scoreBreakdown\": ", lecture);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).startsWith("Malformed JSON");
    }

    @Test
    void rejectsEmptyResponse() {
        assertThat(parser.parse(ProviderId.OPENAI, "   ", lecture).error()).isEqualTo("Empty response");
    }

    @Test
    void rejectsVerdictMissingACriterion() {
        String raw = VerdictJson.of(RubricSpec.of(ContentType.PRE_READ), 0.5, "Wrong rubric");

        ParseResult result = parser.parse(ProviderId.OPENAI, raw, lecture);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).isEqualTo("scoreBreakdown is missing criterion contentStructure");
    }

    @Test
    void rejectsMissingOverallScore() {
        String raw = VerdictJson.of(lecture, 0.5, "Fine").replace("\"overallScore\"", "\"total\"");

        assertThat(parser.parse(ProviderId.OPENAI, raw, lecture).error())
            .isEqualTo("Missing or non-numeric overallScore");
    }

    @Test
    void clampsOutOfRangeScoresWithWarning() {
        String raw = VerdictJson.of(lecture,
            c -> c.key().equals("accuracyCurrency") ? 9 : c.key().equals("topicCoverage") ? -3 : c.maxPoints() / 2,
            "Mixed");

        ParseResult result = parser.parse(ProviderId.OPENAI, raw, lecture);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.output().criterion("accuracyCurrency").score()).isEqualTo(5);
        assertThat(result.output().criterion("topicCoverage").score()).isZero();
        assertThat(result.output().warnings())
            .contains("Clamped accuracyCurrency from 9 to 5", "Clamped topicCoverage from -3 to 0");
    }

    @Test
    void recomputesOverallScoreFromBreakdown() {
        String raw = VerdictJson.of(lecture, 0.5, "Fine").replaceFirst("\"overallScore\":\\d+", "\"overallScore\":99");

        ParseResult result = parser.parse(ProviderId.OPENAI, raw, lecture);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.output().overallScore()).isNotEqualTo(99);
        assertThat(result.output().warnings()).anyMatch(w -> w.startsWith("Reported overallScore 99 replaced"));
    }

    @Test
    void rejectsFeedbackAdmittingManipulation() {
        String raw = VerdictJson.of(lecture, 0.6, "I was tricked by the author");

        ParseResult result = parser.parse(ProviderId.OPENAI, raw, lecture);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).isEqualTo("Response contains suspicious content: tricked");
    }

    @Test
    void rejectsAllPerfectScoresWhenGuardEnabled() {
        String raw = VerdictJson.of(lecture, 1.0, "Flawless");

        assertThat(parser.parse(ProviderId.OPENAI, raw, lecture).error())
            .isEqualTo("Suspiciously perfect scores detected");
        assertThat(new ResponseParser(new ObjectMapper(), false).parse(ProviderId.OPENAI, raw, lecture).isSuccess())
            .isTrue();
    }

    @Test
    void normalizeJsonReturnsFirstFencedBlock() {
        assertThat(ResponseParser.normalizeJson("x\n```json\n{\"a\":1}\n```\n```\n{\"b\":2}\n```"))
            .isEqualTo("{\"a\":1}");
        assertThat(ResponseParser.extractJsonObject("note: {\"a\":1} end")).isEqualTo("{\"a\":1}");
    }

    @Test
    void keepsFenceMarkersInsideExplanations() throws JsonProcessingException {
        ObjectMapper mapper = new ObjectMapper();
        String compact = VerdictJson.of(lecture, 0.6, "The ``` fence in section 2 is never closed");
        String pretty = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(mapper.readTree(compact));

        ParseResult result = parser.parse(ProviderId.OPENAI, pretty, lecture);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.output().criterion("contentStructure").explanation())
            .startsWith("The ``` fence in section 2 is never closed");
    }

    @Test
    void readsFencedVerdictWhoseExplanationsMentionFences() {
        String raw = "```json\n" + VerdictJson.of(lecture, 0.6, "Opens a ``` block\nthat never ends") + "\n```";

        assertThat(parser.parse(ProviderId.GEMINI, raw, lecture).isSuccess()).isTrue();
    }
}
