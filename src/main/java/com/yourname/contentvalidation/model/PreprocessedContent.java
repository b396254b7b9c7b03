package com.yourname.contentvalidation.model;

import java.util.List;

public record PreprocessedContent(
    String cleanedContent,
    List<String> warnings,
    Metadata metadata
) {
    public PreprocessedContent {
        warnings = List.copyOf(warnings);
    }

    public record Metadata(
        int originalLength,
        int cleanedLength,
        boolean hasCodeBlocks,
        boolean hasHeaders,
        boolean hasLists
    ) {}
}
