package com.yourname.contentvalidation.model;

import java.util.List;

public record DetailedFeedback(
    List<String> strengths,
    List<String> weaknesses,
    String suggestion
) {
    public DetailedFeedback {
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        weaknesses = weaknesses == null ? List.of() : List.copyOf(weaknesses);
        suggestion = suggestion == null ? "" : suggestion;
    }
}
