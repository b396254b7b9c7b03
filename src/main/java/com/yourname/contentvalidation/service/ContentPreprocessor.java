package com.yourname.contentvalidation.service;

import com.yourname.contentvalidation.model.PreprocessedContent;
import com.yourname.contentvalidation.model.StructureReport;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Normalizes raw markdown before it is scored and reports anything suspicious about its shape.
 * Pure: the same input always yields the same output, and nothing here ever fails.
 */
@Component
public class ContentPreprocessor {

    static final int SHORT_CONTENT_CHARS = 50;
    static final int LONG_CONTENT_CHARS = 10_000;

    private static final String FENCE = "```";

    private static final Pattern TRAILING_WHITESPACE = Pattern.compile("(?m)[ \\t]+$");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");
    private static final Pattern BOLD_MARKER = Pattern.compile("\\*\\*");
    private static final Pattern LIST_BULLET = Pattern.compile("(?m)^\\s*[*+-]\\s");
    private static final Pattern NUMBERED_ITEM = Pattern.compile("(?m)^\\s*\\d+\\.\\s");
    private static final Pattern HEADER = Pattern.compile("(?m)^#+\\s");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern CODE_KEYWORD = Pattern.compile("(?i)\\b(function|class|import|const|let|var)\\b");

    public PreprocessedContent preprocess(String raw) {
        String input = raw == null ? "" : raw;
        List<String> warnings = new ArrayList<>();

        String cleaned = input.replace("\r\n", "\n").replace('\r', '\n');
        cleaned = TRAILING_WHITESPACE.matcher(cleaned).replaceAll("");
        cleaned = EXCESS_BLANK_LINES.matcher(cleaned).replaceAll("\n\n");
        cleaned = cleaned.strip();

        if (count(cleaned, FENCE) % 2 != 0) {
            warnings.add("Unclosed code blocks detected");
            cleaned = cleaned + "\n" + FENCE;
        }

        if (countMatches(BOLD_MARKER, cleaned) % 2 != 0) {
            warnings.add("Unclosed bold formatting detected");
        }

        if (countItalicMarkers(cleaned) % 2 != 0) {
            warnings.add("Unclosed italic formatting detected");
        }

        if (cleaned.length() < SHORT_CONTENT_CHARS) {
            warnings.add("Content is very short - likely to score poorly");
        }
        if (cleaned.length() > LONG_CONTENT_CHARS) {
            warnings.add("Content is very long - may increase processing time");
        }

        PreprocessedContent.Metadata metadata = new PreprocessedContent.Metadata(
            input.length(),
            cleaned.length(),
            cleaned.contains(FENCE),
            HEADER.matcher(cleaned).find(),
            LIST_BULLET.matcher(cleaned).find() || NUMBERED_ITEM.matcher(cleaned).find()
        );

        return new PreprocessedContent(cleaned, warnings, metadata);
    }

    /**
     * Advisory structure check on already-cleaned content. Only empty or near-empty content
     * makes the report invalid; everything else is a suggestion.
     */
    public StructureReport checkStructure(String content) {
        List<String> issues = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        String trimmed = content == null ? "" : content.strip();

        if (trimmed.isEmpty()) {
            issues.add("Content is empty or only whitespace");
            return new StructureReport(false, issues, suggestions);
        }

        if (trimmed.length() < 10) {
            issues.add("Content is too short to be meaningful");
            suggestions.add("Add more descriptive content");
        }

        if (!HEADER.matcher(trimmed).find()) {
            suggestions.add("Consider adding headers to structure your content");
        }

        long paragraphs = Arrays.stream(PARAGRAPH_BREAK.split(trimmed))
            .filter(p -> !p.isBlank())
            .count();
        if (paragraphs < 2) {
            suggestions.add("Consider breaking content into multiple paragraphs");
        }

        if (!trimmed.contains(FENCE) && CODE_KEYWORD.matcher(trimmed).find()) {
            suggestions.add("Consider using code blocks for code snippets");
        }

        return new StructureReport(issues.isEmpty(), issues, suggestions);
    }

    // -------------------------------------------------------------------------

    private static int countItalicMarkers(String content) {
        String withoutBold = BOLD_MARKER.matcher(content).replaceAll("");
        String withoutBullets = LIST_BULLET.matcher(withoutBold).replaceAll("");
        return count(withoutBullets, "*");
    }

    private static int count(String haystack, String needle) {
        int count = 0;
        int from = 0;
        while ((from = haystack.indexOf(needle, from)) >= 0) {
            count++;
            from += needle.length();
        }
        return count;
    }

    private static int countMatches(Pattern pattern, String content) {
        Matcher matcher = pattern.matcher(content);
        int count = 0;
        while (matcher.find()) count++;
        return count;
    }
}
