package com.yourname.contentvalidation.service;

import com.yourname.contentvalidation.model.ProviderId;
import com.yourname.contentvalidation.model.RubricSpec;
import com.yourname.contentvalidation.model.ValidationOutput;
import com.yourname.contentvalidation.provider.ProviderAdapter;
import com.yourname.contentvalidation.provider.ProviderResult;
import com.yourname.contentvalidation.provider.StubProvider;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * The one place that decides timeout, retry and stub substitution for provider calls.
 * TIMEOUT and TRANSPORT failures are retried up to {@code maxRetries} times; CONFIGURATION and
 * PARSE failures never are. Whatever happens, a verdict comes back.
 */
@Component
public class FallbackController {

    private static final Logger log = LoggerFactory.getLogger(FallbackController.class);

    private final StubProvider stubProvider;
    private final Duration timeout;
    private final int maxRetries;

    public FallbackController(
        StubProvider stubProvider,
        @Value("${validation.provider-timeout-ms:10000}") long timeoutMs,
        @Value("${validation.max-retries:1}") int maxRetries
    ) {
        this.stubProvider = stubProvider;
        this.timeout = Duration.ofMillis(timeoutMs);
        this.maxRetries = maxRetries;
    }

    public ValidationOutput call(ProviderAdapter adapter, String prompt, RubricSpec rubric, String content) {
        int retries = 0;
        ProviderResult result = adapter.invoke(prompt, rubric, timeout);

        while (!result.isSuccess() && result.errorKind().retryable() && retries < maxRetries) {
            retries++;
            log.warn("{} call failed ({}: {}), retry {}/{}",
                adapter.id(), result.errorKind(), result.errorMessage(), retries, maxRetries);
            result = adapter.invoke(prompt, rubric, timeout);
        }

        if (result.isSuccess()) {
            return result.output();
        }

        log.warn("{} degraded to stub verdict after {} attempt(s): {}: {}",
            adapter.id(), retries + 1, result.errorKind(), result.errorMessage());
        return degrade(adapter.id(), content, rubric, result.errorKind() + ": " + result.errorMessage());
    }

    public ValidationOutput degrade(ProviderId provider, String content, RubricSpec rubric, String reason) {
        return stubProvider.verdict(content, rubric).substitutedFor(provider, reason);
    }
}
