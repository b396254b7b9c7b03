package com.yourname.contentvalidation.model;

import java.util.List;

/**
 * Task data the content was written against. Contract checks (non-blank topic,
 * difficulty for assignments) happen when a validation starts, not here.
 */
public record AssignmentContext(
    String topic,
    List<String> topicsTaughtSoFar,
    ContentType contentType,
    Difficulty difficulty
) {
    public AssignmentContext {
        topicsTaughtSoFar = topicsTaughtSoFar == null ? List.of() : List.copyOf(topicsTaughtSoFar);
    }
}
