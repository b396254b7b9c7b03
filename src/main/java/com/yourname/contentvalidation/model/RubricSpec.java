package com.yourname.contentvalidation.model;

import java.util.List;
import java.util.Optional;

/**
 * Ordered, weighted scoring criteria for one content type. Criterion ceilings always sum to 100.
 */
public record RubricSpec(ContentType contentType, String name, List<Criterion> criteria) {

    public record Criterion(String key, String label, int maxPoints, String description) {}

    private static final RubricSpec ASSIGNMENT = new RubricSpec(ContentType.ASSIGNMENT, "Assignment", List.of(
        new Criterion("grammarSpelling", "Grammar and Spelling", 10,
            "Grammatical errors, spelling mistakes and language clarity."),
        new Criterion("topicRelevance", "Topic Relevance", 15,
            "How well the assignment aligns with the specified topic and learning objectives."),
        new Criterion("difficultyDistribution", "Difficulty Distribution", 20,
            "Whether question difficulty is spread appropriately (about 30% easy, 50% medium, 20% hard)."),
        new Criterion("progressiveDifficulty", "Progressive Difficulty", 15,
            "Whether questions progress logically from basic to advanced concepts."),
        new Criterion("creativityEngagement", "Creativity and Engagement", 15,
            "Creative elements, real-world applications and student engagement."),
        new Criterion("claritySpecificity", "Clarity and Specificity", 15,
            "How clear and specific the instructions and questions are."),
        new Criterion("factualCorrectness", "Factual Correctness", 10,
            "Accuracy of the information and concepts presented.")
    ));

    private static final RubricSpec LECTURE_NOTE = new RubricSpec(ContentType.LECTURE_NOTE, "Lecture Note", List.of(
        new Criterion("contentStructure", "Content Structure and Organization", 20,
            "Logical flow, clear headings and well-organized sections."),
        new Criterion("topicCoverage", "Topic Coverage and Depth", 20,
            "Comprehensiveness and appropriate depth for the target audience."),
        new Criterion("clarityReadability", "Clarity and Readability", 15,
            "Language clarity, sentence structure and readability."),
        new Criterion("examplesIllustrations", "Examples and Illustrations", 15,
            "Quality and relevance of examples, diagrams or case studies."),
        new Criterion("learningObjectives", "Learning Objectives Alignment", 15,
            "How well the content aligns with stated or implied learning goals."),
        new Criterion("engagementInteractivity", "Engagement and Interactivity", 10,
            "Elements that promote active learning and student engagement."),
        new Criterion("accuracyCurrency", "Accuracy and Currency", 5,
            "Factual accuracy and relevance of the information.")
    ));

    private static final RubricSpec PRE_READ = new RubricSpec(ContentType.PRE_READ, "Pre-Read", List.of(
        new Criterion("relevanceUpcoming", "Relevance to Upcoming Content", 15,
            "How well the material prepares students for future lessons."),
        new Criterion("accessibilityReadability", "Accessibility and Readability", 15,
            "Language level, clarity and ease of understanding."),
        new Criterion("contentAccuracy", "Content Accuracy", 15,
            "Factual correctness and reliability of the information."),
        new Criterion("engagementFactor", "Engagement Factor", 15,
            "How interesting and motivating the content is for students."),
        new Criterion("lengthScope", "Appropriate Length and Scope", 15,
            "Whether the length is suitable for pre-reading."),
        new Criterion("learningOutcomes", "Clear Learning Outcomes", 10,
            "Whether students will understand what they should learn."),
        new Criterion("sourceQuality", "Source Quality and Citations", 10,
            "Credibility of sources and proper attribution."),
        new Criterion("practicalApplication", "Practical Application", 5,
            "Connections to real-world applications or examples.")
    ));

    public RubricSpec {
        criteria = List.copyOf(criteria);
        int total = criteria.stream().mapToInt(Criterion::maxPoints).sum();
        if (total != 100) {
            throw new IllegalArgumentException("Rubric " + name + " criteria sum to " + total + ", expected 100");
        }
    }

    public static RubricSpec of(ContentType contentType) {
        return switch (contentType) {
            case ASSIGNMENT -> ASSIGNMENT;
            case LECTURE_NOTE -> LECTURE_NOTE;
            case PRE_READ -> PRE_READ;
        };
    }

    public static List<RubricSpec> all() {
        return List.of(PRE_READ, ASSIGNMENT, LECTURE_NOTE);
    }

    public Optional<Criterion> criterion(String key) {
        return criteria.stream().filter(c -> c.key().equals(key)).findFirst();
    }

    public List<String> keys() {
        return criteria.stream().map(Criterion::key).toList();
    }
}
