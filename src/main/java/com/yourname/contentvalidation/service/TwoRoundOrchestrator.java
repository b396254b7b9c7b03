package com.yourname.contentvalidation.service;

import com.yourname.contentvalidation.model.RoundResults;
import com.yourname.contentvalidation.model.RubricSpec;
import com.yourname.contentvalidation.model.ValidationOutput;
import com.yourname.contentvalidation.model.ValidationStage;
import com.yourname.contentvalidation.provider.ProviderAdapter;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the two scoring rounds. Within a round both providers are called concurrently; round 2
 * starts only after both round-1 verdicts (genuine or stub) are in hand, because each round-2
 * prompt carries the peer's round-1 verdict.
 */
public class TwoRoundOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TwoRoundOrchestrator.class);

    private final ProviderAdapter providerA;
    private final ProviderAdapter providerB;
    private final FallbackController fallback;
    private final PromptBuilder promptBuilder;
    private final ExecutorService executor;

    public TwoRoundOrchestrator(
        ProviderAdapter providerA,
        ProviderAdapter providerB,
        FallbackController fallback,
        PromptBuilder promptBuilder,
        ExecutorService executor
    ) {
        this.providerA = providerA;
        this.providerB = providerB;
        this.fallback = fallback;
        this.promptBuilder = promptBuilder;
        this.executor = executor;
    }

    public record RoundOutcome(RoundResults round1, RoundResults round2) {}

    public ProviderAdapter providerA() {
        return providerA;
    }

    public ProviderAdapter providerB() {
        return providerB;
    }

    public RoundOutcome run(String basePrompt, RubricSpec rubric, String content, Consumer<ValidationStage> progress) {
        advance(progress, ValidationStage.ROUND1_PENDING);
        RoundResults round1 = runRound(basePrompt, basePrompt, rubric, content);
        advance(progress, ValidationStage.ROUND1_DONE);

        String promptA = promptBuilder.crossValidationPrompt(basePrompt, round1.providerB());
        String promptB = promptBuilder.crossValidationPrompt(basePrompt, round1.providerA());

        advance(progress, ValidationStage.ROUND2_PENDING);
        RoundResults round2 = runRound(promptA, promptB, rubric, content);
        advance(progress, ValidationStage.ROUND2_DONE);

        return new RoundOutcome(round1, round2);
    }

    // -------------------------------------------------------------------------

    private RoundResults runRound(String promptA, String promptB, RubricSpec rubric, String content) {
        Future<ValidationOutput> a = executor.submit(() -> fallback.call(providerA, promptA, rubric, content));
        Future<ValidationOutput> b = executor.submit(() -> fallback.call(providerB, promptB, rubric, content));
        try {
            return new RoundResults(
                await(a, providerA, rubric, content),
                await(b, providerB, rubric, content)
            );
        } catch (CancellationException e) {
            a.cancel(true);
            b.cancel(true);
            throw e;
        }
    }

    private ValidationOutput await(Future<ValidationOutput> future, ProviderAdapter adapter,
                                   RubricSpec rubric, String content) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Validation cancelled during " + adapter.id() + " call");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CancellationException ce) {
                throw ce;
            }
            log.error("Unexpected failure in {} call, using stub verdict", adapter.id(), e.getCause());
            return fallback.degrade(adapter.id(), content, rubric, "INTERNAL: " + e.getCause());
        }
    }

    private static void advance(Consumer<ValidationStage> progress, ValidationStage stage) {
        log.info("Validation stage {}", stage);
        if (progress != null) progress.accept(stage);
    }
}
