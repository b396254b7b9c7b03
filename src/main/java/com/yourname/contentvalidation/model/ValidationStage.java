package com.yourname.contentvalidation.model;

public enum ValidationStage {
    INIT("Preparing validation..."),
    ROUND1_PENDING("Round 1: scoring independently with both providers..."),
    ROUND1_DONE("Round 1 complete"),
    ROUND2_PENDING("Round 2: cross-validating with peer assessments..."),
    ROUND2_DONE("Round 2 complete"),
    COMBINED("Combining final scores");

    private final String progressMessage;

    ValidationStage(String progressMessage) {
        this.progressMessage = progressMessage;
    }

    public String progressMessage() {
        return progressMessage;
    }
}
