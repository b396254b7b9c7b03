package com.yourname.contentvalidation.model;

public enum Difficulty {
    EASY,
    MEDIUM,
    HARD
}
