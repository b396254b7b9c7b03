package com.yourname.contentvalidation.model;

public enum ContentType {
    PRE_READ,
    ASSIGNMENT,
    LECTURE_NOTE
}
