package com.yourname.contentvalidation.service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Neutralizes instructions aimed at the scoring model before content is placed in a prompt.
 * Content is never rejected here; suspicious phrases are replaced and reported.
 */
@Component
public class PromptSanitizer {

    static final String MODIFIED_MARKER = "[Content modified for security]";
    static final String FREQUENCY_MARKER = "[Term frequency limited]";

    private static final int MAX_TERM_REPEATS = 3;

    private static final List<Pattern> INJECTION_PATTERNS = List.of(
        Pattern.compile("ignore\\s+(all\\s+)?previous\\s+(prompts?|instructions?)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("from\\s+now\\s+on\\s+ignore", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(disregard|forget|override)\\s+(all\\s+)?previous", Pattern.CASE_INSENSITIVE),
        Pattern.compile("new\\s+instructions?:", Pattern.CASE_INSENSITIVE),
        Pattern.compile("system\\s+prompt", Pattern.CASE_INSENSITIVE),
        Pattern.compile("you\\s+are\\s+now", Pattern.CASE_INSENSITIVE),
        Pattern.compile("act\\s+as\\s+if", Pattern.CASE_INSENSITIVE),
        Pattern.compile("pretend\\s+to\\s+be", Pattern.CASE_INSENSITIVE),
        Pattern.compile("roleplay\\s+as", Pattern.CASE_INSENSITIVE),
        Pattern.compile("score\\s+(100|perfect|maximum)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("give\\s+(me\\s+)?(100|perfect|maximum)\\s+score", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(make\\s+sure|ensure|guarantee)\\s+(the\\s+)?(final\\s+)?output\\s+scores?\\s+(100|perfect)",
            Pattern.CASE_INSENSITIVE),
        Pattern.compile("validation\\s+bypass", Pattern.CASE_INSENSITIVE),
        Pattern.compile("hack\\s+the\\s+system", Pattern.CASE_INSENSITIVE),
        Pattern.compile("exploit\\s+the\\s+validator", Pattern.CASE_INSENSITIVE),
        Pattern.compile("manipulate\\s+the\\s+score", Pattern.CASE_INSENSITIVE),
        Pattern.compile("trick\\s+the\\s+ai", Pattern.CASE_INSENSITIVE),
        Pattern.compile("jailbreak", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(prompt\\s+injection|injection\\s+attack)", Pattern.CASE_INSENSITIVE)
    );

    private static final List<String> BAIT_TERMS =
        List.of("ignore", "disregard", "override", "score", "100", "perfect", "maximum");

    public SanitizedContent sanitize(String content) {
        String sanitized = content == null ? "" : content;
        List<String> warnings = new ArrayList<>();

        int replaced = 0;
        for (Pattern pattern : INJECTION_PATTERNS) {
            Matcher matcher = pattern.matcher(sanitized);
            int hits = 0;
            while (matcher.find()) hits++;
            if (hits > 0) {
                replaced += hits;
                sanitized = matcher.replaceAll(Matcher.quoteReplacement(MODIFIED_MARKER));
            }
        }
        if (replaced > 0) {
            warnings.add("Removed " + replaced + " instruction-like phrase(s) aimed at the scoring model");
        }

        for (String term : BAIT_TERMS) {
            Pattern word = Pattern.compile("\\b" + Pattern.quote(term) + "\\b", Pattern.CASE_INSENSITIVE);
            Matcher matcher = word.matcher(sanitized);
            int hits = 0;
            while (matcher.find()) hits++;
            if (hits > MAX_TERM_REPEATS) {
                sanitized = matcher.replaceAll(Matcher.quoteReplacement(FREQUENCY_MARKER));
                warnings.add("Limited repeated use of the term '" + term + "' (" + hits + " occurrences)");
            }
        }

        return new SanitizedContent(sanitized, warnings);
    }

    public record SanitizedContent(String content, List<String> warnings) {
        public SanitizedContent {
            warnings = List.copyOf(warnings);
        }
    }
}
