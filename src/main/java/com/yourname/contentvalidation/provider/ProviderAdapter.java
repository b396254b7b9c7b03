package com.yourname.contentvalidation.provider;

import com.yourname.contentvalidation.exception.ProviderErrorKind;
import com.yourname.contentvalidation.exception.ProviderException;
import com.yourname.contentvalidation.model.ProviderId;
import com.yourname.contentvalidation.model.RubricSpec;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends a prompt to one provider and reads back a verdict. Every failure comes back as a
 * {@link ProviderResult}; only caller cancellation escapes, as {@link CancellationException}.
 */
public class ProviderAdapter {

    private final ProviderClient client;
    private final ResponseParser parser;
    private final ExecutorService executor;

    public ProviderAdapter(ProviderClient client, ResponseParser parser, ExecutorService executor) {
        this.client = client;
        this.parser = parser;
        this.executor = executor;
    }

    public ProviderId id() {
        return client.id();
    }

    public boolean isConfigured() {
        return client.isConfigured();
    }

    public ProviderResult invoke(String prompt, RubricSpec rubric, Duration timeout) {
        if (!client.isConfigured()) {
            return ProviderResult.failure(id(), ProviderErrorKind.CONFIGURATION,
                "No credential or endpoint configured for " + id());
        }

        Future<String> call = executor.submit(() -> client.complete(prompt));
        String raw;
        try {
            raw = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // A late answer is dropped along with the cancelled task.
            call.cancel(true);
            return ProviderResult.failure(id(), ProviderErrorKind.TIMEOUT,
                "No response within " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderException pe) {
                return ProviderResult.failure(id(), pe.kind(), pe.getMessage());
            }
            return ProviderResult.failure(id(), ProviderErrorKind.TRANSPORT,
                cause == null ? "Provider call failed" : cause.toString());
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Validation cancelled while waiting for " + id());
        }

        ParseResult parsed = parser.parse(id(), raw, rubric);
        if (!parsed.isSuccess()) {
            return ProviderResult.failure(id(), ProviderErrorKind.PARSE, parsed.error());
        }
        return ProviderResult.success(parsed.output());
    }
}
