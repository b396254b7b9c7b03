package com.yourname.contentvalidation.model;

public record CriterionScore(int score, String explanation) {}
