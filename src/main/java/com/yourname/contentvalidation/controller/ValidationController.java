package com.yourname.contentvalidation.controller;

import com.yourname.contentvalidation.model.DualValidationResult;
import com.yourname.contentvalidation.model.ValidateContentRequest;
import com.yourname.contentvalidation.model.ValidationRequest;
import com.yourname.contentvalidation.service.ContentValidationService;
import com.yourname.contentvalidation.validation.RequestValidator;
import java.io.IOException;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api")
public class ValidationController {

    private static final Logger log = LoggerFactory.getLogger(ValidationController.class);

    private final ContentValidationService validationService;
    private final RequestValidator requestValidator;
    private final ExecutorService executor;

    public ValidationController(
        ContentValidationService validationService,
        RequestValidator requestValidator,
        @Qualifier("providerExecutor") ExecutorService executor
    ) {
        this.validationService = validationService;
        this.requestValidator = requestValidator;
        this.executor = executor;
    }

    @PostMapping("/validate")
    public DualValidationResult validate(@RequestBody ValidateContentRequest body) {
        return validationService.validate(requestValidator.toValidationRequest(body));
    }

    /**
     * Same pipeline as {@link #validate}, reporting each stage as a {@code progress} event and the
     * final result as a {@code result} event. Bad input is rejected before the stream opens.
     */
    @PostMapping(path = "/validate/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter validateStream(@RequestBody ValidateContentRequest body) {
        ValidationRequest request = requestValidator.toValidationRequest(body);
        requestValidator.requireValid(request);

        SseEmitter emitter = new SseEmitter(0L);

        executor.submit(() -> {
            try {
                DualValidationResult result = validationService.validateWithProgress(
                    request,
                    message -> sendEvent(emitter, "progress", message)
                );
                sendEvent(emitter, "result", result);
                emitter.complete();
            } catch (Exception ex) {
                log.error("Streaming validation failed", ex);
                try {
                    sendEvent(emitter, "error", "Validation failed. Please try again.");
                } finally {
                    emitter.completeWithError(ex);
                }
            }
        });

        return emitter;
    }

    private void sendEvent(SseEmitter emitter, String name, Object data) {
        try {
            emitter.send(SseEmitter.event().name(name).data(data));
        } catch (IOException ex) {
            emitter.completeWithError(ex);
        }
    }
}
