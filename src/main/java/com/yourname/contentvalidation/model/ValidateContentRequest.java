package com.yourname.contentvalidation.model;

import java.util.List;

public record ValidateContentRequest(
    String content,
    ContentType contentType,
    String topic,
    List<String> topicsTaughtSoFar,
    Difficulty difficulty,
    String guidelines,
    String brief,
    String promptTemplate
) {}
