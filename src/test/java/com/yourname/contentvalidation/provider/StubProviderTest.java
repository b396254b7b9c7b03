package com.yourname.contentvalidation.provider;

import static org.assertj.core.api.Assertions.assertThat;

import com.yourname.contentvalidation.model.ContentType;
import com.yourname.contentvalidation.model.ProviderId;
import com.yourname.contentvalidation.model.RubricSpec;
import com.yourname.contentvalidation.model.ValidationOutput;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class StubProviderTest {

    private final StubProvider stub = new StubProvider();
    private final RubricSpec preRead = RubricSpec.of(ContentType.PRE_READ);

    @Test
    void verdictIsLabelledAndCoversEveryCriterion() {
        ValidationOutput output = stub.verdict("# Intro\n\nSome words about the upcoming unit.", preRead);

        assertThat(output.provider()).isEqualTo(ProviderId.LOCAL);
        assertThat(output.stub()).isTrue();
        assertThat(output.scoreBreakdown()).containsOnlyKeys(preRead.keys());
        assertThat(output.scoreBreakdown().values())
            .allSatisfy(s -> assertThat(s.explanation()).startsWith(StubProvider.LABEL));
        assertThat(output.detailedFeedback().suggestion()).startsWith(StubProvider.LABEL);
    }

    @Test
    void sameInputGivesSameVerdict() {
        String content = "# Heaps\n\n- insert\n- extract\n\nA heap keeps its smallest element at the root.";

        assertThat(stub.verdict(content, preRead)).isEqualTo(stub.verdict(content, preRead));
    }

    @Test
    void scoresStayWithinCeilingsAndSumToOverall() {
        ValidationOutput output = stub.verdict("x".repeat(5_000), preRead);

        for (RubricSpec.Criterion c : preRead.criteria()) {
            assertThat(output.criterion(c.key()).score()).isBetween(0, c.maxPoints());
        }
        assertThat(output.overallScore())
            .isEqualTo(output.scoreBreakdown().values().stream().mapToInt(s -> s.score()).sum())
            .isLessThan(100);
    }

    @Test
    void structuredLongerContentScoresHigherThanTinyContent() {
        String structured = """
            # Graphs

            A graph is a set of vertices connected by edges. We will use graphs to model networks.

            ## Terms

            - vertex
            - edge
            - path

            Next week we build on this with breadth-first search.
            """;

        ValidationOutput tiny = stub.verdict("# Test", preRead);
        ValidationOutput rich = stub.verdict(structured, preRead);

        assertThat(rich.overallScore()).isGreaterThan(tiny.overallScore());
        assertThat(tiny.detailedFeedback().weaknesses()).contains("Content is very short");
    }

    @Test
    void substitutionKeepsScoresAndRecordsReason() {
        ValidationOutput output = stub.verdict("# Test", preRead)
            .substitutedFor(ProviderId.GEMINI, "CONFIGURATION: No credential or endpoint configured for GEMINI");

        assertThat(output.provider()).isEqualTo(ProviderId.GEMINI);
        assertThat(output.stub()).isTrue();
        assertThat(output.genuine()).isFalse();
        assertThat(output.fallbackReason()).startsWith("CONFIGURATION");
    }

    @Test
    void explanationsDoNotDependOnDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            ValidationOutput output = stub.verdict("# Closures\n\nA closure captures variables.",
                RubricSpec.of(ContentType.LECTURE_NOTE));

            assertThat(output.criterion("examplesIllustrations").explanation())
                .contains("placeholder examples and illustrations score");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
