package com.yourname.contentvalidation.model;

public record RoundResults(ValidationOutput providerA, ValidationOutput providerB) {}
