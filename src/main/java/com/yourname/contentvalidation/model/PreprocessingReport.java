package com.yourname.contentvalidation.model;

import java.util.List;

public record PreprocessingReport(
    List<String> warnings,
    PreprocessedContent.Metadata metadata,
    StructureReport structure
) {
    public PreprocessingReport {
        warnings = List.copyOf(warnings);
    }
}
