package com.yourname.contentvalidation.model;

import java.util.List;

public record StructureReport(boolean valid, List<String> issues, List<String> suggestions) {
    public StructureReport {
        issues = List.copyOf(issues);
        suggestions = List.copyOf(suggestions);
    }
}
