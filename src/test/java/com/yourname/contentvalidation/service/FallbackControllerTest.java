package com.yourname.contentvalidation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.yourname.contentvalidation.exception.ProviderErrorKind;
import com.yourname.contentvalidation.model.ContentType;
import com.yourname.contentvalidation.model.ProviderId;
import com.yourname.contentvalidation.model.RubricSpec;
import com.yourname.contentvalidation.model.ValidationOutput;
import com.yourname.contentvalidation.provider.ProviderAdapter;
import com.yourname.contentvalidation.provider.ProviderResult;
import com.yourname.contentvalidation.provider.StubProvider;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FallbackControllerTest {

    private static final String CONTENT = "# Sorting\n\nBubble sort swaps adjacent items.";

    @Mock
    private ProviderAdapter adapter;

    private final StubProvider stubProvider = new StubProvider();
    private final RubricSpec rubric = RubricSpec.of(ContentType.LECTURE_NOTE);
    private FallbackController fallback;

    @BeforeEach
    void setUp() {
        fallback = new FallbackController(stubProvider, 1_000, 1);
        lenient().when(adapter.id()).thenReturn(ProviderId.OPENAI);
    }

    @Test
    void genuineVerdictPassesThrough() {
        ValidationOutput genuine = genuineVerdict();
        when(adapter.invoke(anyString(), eq(rubric), any(Duration.class))).thenReturn(ProviderResult.success(genuine));

        assertThat(fallback.call(adapter, "prompt", rubric, CONTENT)).isSameAs(genuine);
        verify(adapter, times(1)).invoke(anyString(), eq(rubric), eq(Duration.ofMillis(1_000)));
    }

    @Test
    void timeoutIsRetriedOnce() {
        ValidationOutput genuine = genuineVerdict();
        when(adapter.invoke(anyString(), eq(rubric), any(Duration.class))).thenReturn(
            ProviderResult.failure(ProviderId.OPENAI, ProviderErrorKind.TIMEOUT, "No response within 1000ms"),
            ProviderResult.success(genuine));

        assertThat(fallback.call(adapter, "prompt", rubric, CONTENT)).isSameAs(genuine);
        verify(adapter, times(2)).invoke(anyString(), eq(rubric), any(Duration.class));
    }

    @Test
    void persistentTransportFailureDegradesAfterRetries() {
        when(adapter.invoke(anyString(), eq(rubric), any(Duration.class))).thenReturn(
            ProviderResult.failure(ProviderId.OPENAI, ProviderErrorKind.TRANSPORT, "OpenAI returned HTTP 503"));

        ValidationOutput output = fallback.call(adapter, "prompt", rubric, CONTENT);

        verify(adapter, times(2)).invoke(anyString(), eq(rubric), any(Duration.class));
        assertThat(output.stub()).isTrue();
        assertThat(output.provider()).isEqualTo(ProviderId.OPENAI);
        assertThat(output.fallbackReason()).isEqualTo("TRANSPORT: OpenAI returned HTTP 503");
    }

    @Test
    void configurationFailureIsNotRetried() {
        when(adapter.invoke(anyString(), eq(rubric), any(Duration.class))).thenReturn(
            ProviderResult.failure(ProviderId.OPENAI, ProviderErrorKind.CONFIGURATION, "No credential"));

        ValidationOutput output = fallback.call(adapter, "prompt", rubric, CONTENT);

        verify(adapter, times(1)).invoke(anyString(), eq(rubric), any(Duration.class));
        assertThat(output.fallbackReason()).startsWith("CONFIGURATION");
    }

    @Test
    void parseFailureIsNotRetried() {
        when(adapter.invoke(anyString(), eq(rubric), any(Duration.class))).thenReturn(
            ProviderResult.failure(ProviderId.OPENAI, ProviderErrorKind.PARSE, "Malformed JSON: eof"));

        ValidationOutput output = fallback.call(adapter, "prompt", rubric, CONTENT);

        verify(adapter, times(1)).invoke(anyString(), eq(rubric), any(Duration.class));
        assertThat(output.stub()).isTrue();
        assertThat(output.scoreBreakdown()).isEqualTo(stubProvider.verdict(CONTENT, rubric).scoreBreakdown());
    }

    @Test
    void shippedTimeoutKeepsBothRoundsWithinFortySeconds() throws IOException {
        Properties shipped = new Properties();
        try (Reader reader = Files.newBufferedReader(Path.of("src/main/resources/application.properties"))) {
            shipped.load(reader);
        }
        long timeoutMs = Long.parseLong(shipped.getProperty("validation.provider-timeout-ms"));
        int retries = Integer.parseInt(shipped.getProperty("validation.max-retries"));

        // Providers run in parallel, so each round costs one provider's attempts.
        assertThat(timeoutMs).isEqualTo(10_000);
        assertThat(2 * timeoutMs * (retries + 1)).isLessThanOrEqualTo(40_000);
    }

    private ValidationOutput genuineVerdict() {
        ValidationOutput base = stubProvider.verdict(CONTENT, rubric);
        return new ValidationOutput(ProviderId.OPENAI, false, base.overallScore(), base.scoreBreakdown(),
            base.detailedFeedback(), base.warnings(), null);
    }
}
