package com.yourname.contentvalidation.model;

/**
 * One engine invocation. {@code promptTemplate}, {@code guidelines} and {@code brief} are
 * opaque caller-supplied strings; a null template selects the built-in one for the rubric.
 */
public record ValidationRequest(
    String content,
    AssignmentContext context,
    String promptTemplate,
    String guidelines,
    String brief
) {
    public static ValidationRequest of(String content, AssignmentContext context) {
        return new ValidationRequest(content, context, null, null, null);
    }
}
