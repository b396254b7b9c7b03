package com.yourname.contentvalidation.service;

import com.yourname.contentvalidation.model.CombinedScore;
import com.yourname.contentvalidation.model.DualValidationResult;
import com.yourname.contentvalidation.model.PreprocessedContent;
import com.yourname.contentvalidation.model.PreprocessingReport;
import com.yourname.contentvalidation.model.ProviderId;
import com.yourname.contentvalidation.model.RubricSpec;
import com.yourname.contentvalidation.model.StructureReport;
import com.yourname.contentvalidation.model.ValidationOutput;
import com.yourname.contentvalidation.model.ValidationRequest;
import com.yourname.contentvalidation.model.ValidationStage;
import com.yourname.contentvalidation.service.PromptSanitizer.SanitizedContent;
import com.yourname.contentvalidation.service.TwoRoundOrchestrator.RoundOutcome;
import com.yourname.contentvalidation.validation.RequestValidator;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ContentValidationService {

    private static final Logger log = LoggerFactory.getLogger(ContentValidationService.class);

    private final RequestValidator requestValidator;
    private final ContentPreprocessor preprocessor;
    private final PromptSanitizer sanitizer;
    private final PromptBuilder promptBuilder;
    private final TwoRoundOrchestrator orchestrator;
    private final ScoreCombiner combiner;

    public ContentValidationService(
        RequestValidator requestValidator,
        ContentPreprocessor preprocessor,
        PromptSanitizer sanitizer,
        PromptBuilder promptBuilder,
        TwoRoundOrchestrator orchestrator,
        ScoreCombiner combiner
    ) {
        this.requestValidator = requestValidator;
        this.preprocessor = preprocessor;
        this.sanitizer = sanitizer;
        this.promptBuilder = promptBuilder;
        this.orchestrator = orchestrator;
        this.combiner = combiner;
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    public DualValidationResult validate(ValidationRequest request) {
        return validateWithProgress(request, null);
    }

    /**
     * Runs the full pipeline. Provider failures never surface here; the only exception a caller
     * sees is a {@link com.yourname.contentvalidation.exception.ContractViolationException}.
     */
    public DualValidationResult validateWithProgress(ValidationRequest request, Consumer<String> progress) {
        requestValidator.requireValid(request);
        long started = System.nanoTime();
        notify(progress, ValidationStage.INIT);

        RubricSpec rubric = RubricSpec.of(request.context().contentType());
        PreprocessedContent preprocessed = preprocessor.preprocess(request.content());
        StructureReport structure = preprocessor.checkStructure(preprocessed.cleanedContent());
        SanitizedContent sanitized = sanitizer.sanitize(preprocessed.cleanedContent());

        List<String> warnings = new ArrayList<>(preprocessed.warnings());
        warnings.addAll(sanitized.warnings());
        if (!warnings.isEmpty()) {
            log.info("Content preprocessing warnings: {}", warnings);
        }
        log.info("Starting dual validation: type={}, topic='{}', length={} chars",
            rubric.contentType(), request.context().topic(), preprocessed.cleanedContent().length());

        String basePrompt = promptBuilder.basePrompt(rubric, request, sanitized.content());
        RoundOutcome outcome = orchestrator.run(basePrompt, rubric, preprocessed.cleanedContent(),
            stage -> notify(progress, stage));

        notify(progress, ValidationStage.COMBINED);
        CombinedScore combined = combiner.combine(rubric, outcome.round2());

        Set<ProviderId> providers = EnumSet.noneOf(ProviderId.class);
        for (ValidationOutput output : List.of(outcome.round2().providerA(), outcome.round2().providerB())) {
            if (output.genuine()) providers.add(output.provider());
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        log.info("Dual validation finished: overall={}, confidence={}, providers={}, {}ms",
            combined.overallScore(), combined.overallConfidence(), providers, elapsedMs);

        return new DualValidationResult(
            rubric.contentType(),
            outcome.round1(),
            outcome.round2(),
            combined.finalScore(),
            combined.finalFeedback(),
            combined.overallScore(),
            combined.overallConfidence(),
            providers,
            elapsedMs,
            new PreprocessingReport(warnings, preprocessed.metadata(), structure)
        );
    }

    private static void notify(Consumer<String> progress, ValidationStage stage) {
        if (progress != null) progress.accept(stage.progressMessage());
    }
}
