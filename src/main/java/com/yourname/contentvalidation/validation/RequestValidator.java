package com.yourname.contentvalidation.validation;

import com.yourname.contentvalidation.exception.ContractViolationException;
import com.yourname.contentvalidation.model.AssignmentContext;
import com.yourname.contentvalidation.model.ContentType;
import com.yourname.contentvalidation.model.ValidateContentRequest;
import com.yourname.contentvalidation.model.ValidationRequest;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Validates inbound requests and the engine's own input contract.
 * Every failure is a {@link ContractViolationException} with a user-safe message.
 */
@Component
public class RequestValidator {

    private static final int MAX_CONTENT_CHARS    = 50_000;
    private static final int MAX_TOPIC_CHARS      = 200;
    private static final int MAX_GUIDELINES_CHARS = 20_000;
    private static final int MAX_BRIEF_CHARS      = 5_000;
    private static final int MAX_TEMPLATE_CHARS   = 50_000;

    static final String DEFAULT_TOPIC = "General Content";
    static final List<String> DEFAULT_TOPICS_TAUGHT = List.of("General Knowledge");

    private static final Pattern FIRST_HEADER = Pattern.compile("(?m)^#+\\s*(.+)$");

    /**
     * Builds an engine request from the HTTP payload, filling topic, prerequisites and content
     * type defaults where the caller left them out.
     */
    public ValidationRequest toValidationRequest(ValidateContentRequest request) {
        if (request == null) {
            throw new ContractViolationException("Request body is required.");
        }

        String content = requireNonBlank(sanitize(request.content(), MAX_CONTENT_CHARS, "Content"), "Content");
        String topic = sanitize(request.topic(), MAX_TOPIC_CHARS, "Topic");
        if (topic == null || topic.isBlank()) {
            topic = extractTopic(content);
        }

        List<String> taught = request.topicsTaughtSoFar() == null || request.topicsTaughtSoFar().isEmpty()
            ? DEFAULT_TOPICS_TAUGHT
            : request.topicsTaughtSoFar().stream().map(t -> t == null ? "" : t.strip()).toList();

        ContentType contentType = request.contentType() == null ? ContentType.LECTURE_NOTE : request.contentType();

        AssignmentContext context = new AssignmentContext(topic, taught, contentType, request.difficulty());
        return new ValidationRequest(
            content,
            context,
            sanitize(request.promptTemplate(), MAX_TEMPLATE_CHARS, "Prompt template"),
            sanitize(request.guidelines(), MAX_GUIDELINES_CHARS, "Guidelines"),
            sanitize(request.brief(), MAX_BRIEF_CHARS, "Brief")
        );
    }

    /** Engine input contract. Checked before any provider is contacted. */
    public void requireValid(ValidationRequest request) {
        if (request == null) {
            throw new ContractViolationException("Validation request is required.");
        }
        if (request.content() == null) {
            throw new ContractViolationException("Content is required.");
        }
        AssignmentContext context = request.context();
        if (context == null) {
            throw new ContractViolationException("Assignment context is required.");
        }
        if (context.contentType() == null) {
            throw new ContractViolationException("Content type is required.");
        }
        requireNonBlank(context.topic(), "Topic");
        if (context.topicsTaughtSoFar().isEmpty()
            || context.topicsTaughtSoFar().stream().anyMatch(t -> t == null || t.isBlank())) {
            throw new ContractViolationException("Topics taught so far must be a non-empty list of labels.");
        }
        if (context.contentType() == ContentType.ASSIGNMENT && context.difficulty() == null) {
            throw new ContractViolationException("Difficulty is required when content type is ASSIGNMENT.");
        }
    }

    /**
     * First markdown header, else a first sentence of sensible length, else a generic label.
     */
    static String extractTopic(String content) {
        Matcher header = FIRST_HEADER.matcher(content);
        if (header.find() && !header.group(1).isBlank()) {
            return header.group(1).strip();
        }
        String firstSentence = content.split("[.!?]", 2)[0].strip();
        if (firstSentence.length() > 10 && firstSentence.length() < 100) {
            return firstSentence;
        }
        return DEFAULT_TOPIC;
    }

    // -------------------------------------------------------------------------

    private String sanitize(String value, int maxChars, String fieldName) {
        if (value == null) return null;
        String trimmed = value.strip();
        if (trimmed.length() > maxChars) {
            throw new ContractViolationException(
                fieldName + " exceeds maximum length of " + maxChars + " characters.");
        }
        return trimmed;
    }

    private String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new ContractViolationException(fieldName + " is required.");
        }
        return value;
    }
}
