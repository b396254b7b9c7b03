package com.yourname.contentvalidation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yourname.contentvalidation.model.AssignmentContext;
import com.yourname.contentvalidation.model.CriterionScore;
import com.yourname.contentvalidation.model.RubricSpec;
import com.yourname.contentvalidation.model.ValidationOutput;
import com.yourname.contentvalidation.model.ValidationRequest;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class PromptBuilder {

    private static final Logger log = LoggerFactory.getLogger(PromptBuilder.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Z][A-Z_]*)\\}");
    private static final String NOT_AVAILABLE = "N/A";

    static final String PEER_SECTION_START = "<<<PEER_ASSESSMENT";
    static final String PEER_SECTION_END = "PEER_ASSESSMENT>>>";

    public record TemplateVariable(String name, String description, boolean required) {}

    public static final List<TemplateVariable> VARIABLES = List.of(
        new TemplateVariable("TOPIC", "The main topic the content must cover", true),
        new TemplateVariable("TOPICS_TAUGHT_SO_FAR", "Comma-separated prerequisite topics", true),
        new TemplateVariable("PREREQUISITES", "Alias of TOPICS_TAUGHT_SO_FAR", false),
        new TemplateVariable("CONTENT", "The markdown content being validated", true),
        new TemplateVariable("CONTENT_TYPE", "PRE_READ, ASSIGNMENT or LECTURE_NOTE", false),
        new TemplateVariable("DIFFICULTY", "EASY, MEDIUM or HARD for assignments", false),
        new TemplateVariable("GUIDELINES", "Active authoring guidelines for the content type", false),
        new TemplateVariable("BRIEF", "Additional brief from the task author", false),
        new TemplateVariable("CRITERIA", "Numbered rubric criteria with point ceilings", false),
        new TemplateVariable("OUTPUT_FORMAT", "The JSON shape the model must return", false)
    );

    private static final String DEFAULT_TEMPLATE = """
        # {CONTENT_TYPE} Validation

        You are an expert educational content validator. Analyze the following content and provide
        a comprehensive, evidence-based evaluation.

        ## Context

        **Topic:** {TOPIC}
        **Topics Taught So Far:** {TOPICS_TAUGHT_SO_FAR}
        **Difficulty:** {DIFFICULTY}
        **Guidelines:** {GUIDELINES}
        **Brief:** {BRIEF}

        **Content:**
        ```
        {CONTENT}
        ```

        ## Evaluation Criteria

        Score each criterion with an integer between 0 and its ceiling:

        {CRITERIA}

        ## Required JSON Output Format

        Respond ONLY with a single valid JSON object in exactly this shape, no additional text:

        {OUTPUT_FORMAT}
        """;

    private final ObjectMapper objectMapper;

    public PromptBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // -------------------------------------------------------------------------
    // Rendering
    // -------------------------------------------------------------------------

    /**
     * Replaces every {@code {NAME}} token that has a value in {@code vars}. Unknown tokens stay
     * verbatim. Substituted values are not scanned again, so content containing braces is inert.
     */
    public String render(String template, Map<String, String> vars) {
        Matcher matcher = PLACEHOLDER.matcher(template == null ? "" : template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = vars.get(matcher.group(1));
            String replacement = value != null ? value : matcher.group(0);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public String basePrompt(RubricSpec rubric, ValidationRequest request, String content) {
        String template = request.promptTemplate();
        if (template == null || template.isBlank()) {
            template = DEFAULT_TEMPLATE;
        } else if (!template.contains("{CONTENT}")) {
            log.warn("Prompt template for {} has no {CONTENT} placeholder; appending a content section",
                rubric.contentType());
            template = template + "\n\n## Content to Validate\n```\n{CONTENT}\n```\n";
        }
        return render(template, variables(rubric, request, content));
    }

    /**
     * Round-2 prompt: the provider's own base prompt plus the peer's round-1 verdict in a
     * delimited section. A stub peer verdict is still embedded, labelled as a placeholder.
     */
    public String crossValidationPrompt(String basePrompt, ValidationOutput peer) {
        Objects.requireNonNull(peer, "peer verdict");
        StringBuilder sb = new StringBuilder(basePrompt.stripTrailing()).append("\n\n");
        sb.append("## Peer Assessment (Round 2)\n\n");

        if (peer.stub()) {
            sb.append("The peer reviewer (").append(peer.provider())
                .append(") was unavailable, so the section below is a PLACEHOLDER generated from ")
                .append("content length and structure, not an independent assessment. Reason: ")
                .append(peer.fallbackReason() == null ? NOT_AVAILABLE : peer.fallbackReason())
                .append(".\n\n");
        } else {
            sb.append("Another independent reviewer (").append(peer.provider())
                .append(") produced the following assessment of the same content:\n\n");
        }
        sb.append(PEER_SECTION_START).append('\n')
            .append(toWireJson(peer)).append('\n')
            .append(PEER_SECTION_END).append("\n\n");

        if (peer.stub()) {
            sb.append("""
                Do not weigh the placeholder scores. Re-examine the content carefully and return your \
                own complete assessment.
                """);
        } else {
            sb.append("""
                Weigh the peer assessment against the content itself. Where the peer found a problem \
                you missed, verify it and adjust. Where you disagree, keep your own score and justify \
                it in the explanation. Do not simply average the two assessments.
                """);
        }

        sb.append("\nReturn ONLY the JSON object in the required output format.\n");
        return sb.toString();
    }

    // -------------------------------------------------------------------------
    // Variables
    // -------------------------------------------------------------------------

    private Map<String, String> variables(RubricSpec rubric, ValidationRequest request, String content) {
        AssignmentContext context = request.context();
        String prerequisites = context.topicsTaughtSoFar().isEmpty()
            ? NOT_AVAILABLE
            : String.join(", ", context.topicsTaughtSoFar());

        Map<String, String> vars = new LinkedHashMap<>();
        vars.put("TOPIC", orNotAvailable(context.topic()));
        vars.put("TOPICS_TAUGHT_SO_FAR", prerequisites);
        vars.put("PREREQUISITES", prerequisites);
        vars.put("CONTENT", content);
        vars.put("CONTENT_TYPE", rubric.name());
        vars.put("DIFFICULTY", context.difficulty() == null ? NOT_AVAILABLE : context.difficulty().name());
        vars.put("GUIDELINES", orNotAvailable(request.guidelines()));
        vars.put("BRIEF", orNotAvailable(request.brief()));
        vars.put("CRITERIA", criteriaText(rubric));
        vars.put("OUTPUT_FORMAT", outputFormat(rubric));
        return vars;
    }

    private static String criteriaText(RubricSpec rubric) {
        StringBuilder sb = new StringBuilder();
        int i = 1;
        for (RubricSpec.Criterion c : rubric.criteria()) {
            if (sb.length() > 0) sb.append("\n\n");
            sb.append(i++).append(". **").append(c.label()).append(" (0-").append(c.maxPoints())
                .append(" points)** [`").append(c.key()).append("`]: ").append(c.description());
        }
        return sb.toString();
    }

    private String outputFormat(RubricSpec rubric) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("overallScore", "[Total score out of 100, the sum of all criterion scores]");
        ObjectNode breakdown = root.putObject("scoreBreakdown");
        for (RubricSpec.Criterion c : rubric.criteria()) {
            ObjectNode node = breakdown.putObject(c.key());
            node.put("score", "[Score out of " + c.maxPoints() + "]");
            node.put("explanation", "[Brief explanation]");
        }
        ObjectNode feedback = root.putObject("detailedFeedback");
        feedback.putArray("strengths").add("[Strength 1]").add("[Strength 2]").add("[Strength 3]");
        feedback.putArray("weaknesses").add("[Weakness 1]").add("[Weakness 2]").add("[Weakness 3]");
        feedback.put("suggestion", "[One actionable improvement recommendation]");
        return "```json\n" + pretty(root) + "\n```";
    }

    private String toWireJson(ValidationOutput output) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("overallScore", output.overallScore());
        ObjectNode breakdown = root.putObject("scoreBreakdown");
        for (Map.Entry<String, CriterionScore> entry : output.scoreBreakdown().entrySet()) {
            ObjectNode node = breakdown.putObject(entry.getKey());
            node.put("score", entry.getValue().score());
            node.put("explanation", entry.getValue().explanation());
        }
        ObjectNode feedback = root.putObject("detailedFeedback");
        ArrayNode strengths = feedback.putArray("strengths");
        output.detailedFeedback().strengths().forEach(strengths::add);
        ArrayNode weaknesses = feedback.putArray("weaknesses");
        output.detailedFeedback().weaknesses().forEach(weaknesses::add);
        feedback.put("suggestion", output.detailedFeedback().suggestion());
        return pretty(root);
    }

    private String pretty(ObjectNode node) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize prompt JSON", e);
        }
    }

    private static String orNotAvailable(String value) {
        return value == null || value.isBlank() ? NOT_AVAILABLE : value.strip();
    }
}
