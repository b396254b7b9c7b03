package com.yourname.contentvalidation.controller;

import com.yourname.contentvalidation.model.ContentType;
import com.yourname.contentvalidation.model.RubricSpec;
import com.yourname.contentvalidation.service.PromptBuilder;
import com.yourname.contentvalidation.service.PromptBuilder.TemplateVariable;
import java.util.List;
import java.util.Locale;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Read-only discovery of rubrics and prompt template variables. */
@RestController
@RequestMapping("/api")
public class RubricController {

    @GetMapping("/rubrics")
    public List<RubricSpec> rubrics() {
        return RubricSpec.all();
    }

    @GetMapping("/rubrics/{contentType}")
    public RubricSpec rubric(@PathVariable String contentType) {
        return RubricSpec.of(parseContentType(contentType));
    }

    @GetMapping("/prompts/variables")
    public List<TemplateVariable> variables() {
        return PromptBuilder.VARIABLES;
    }

    private ContentType parseContentType(String raw) {
        String normalized = raw.strip().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return ContentType.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown content type: " + raw
                + ". Expected one of PRE_READ, ASSIGNMENT, LECTURE_NOTE.", ex);
        }
    }
}
