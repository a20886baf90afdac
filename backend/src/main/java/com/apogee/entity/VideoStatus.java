package com.apogee.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VideoStatus implements LabeledEnum {
    DRAFT("draft"),
    SCRIPTED("scripted"),
    RENDERED("rendered"),
    PUBLISHED("published"),
    FAILED("failed");

    private final String label;

    VideoStatus(String label) {
        this.label = label;
    }

    @JsonValue
    @Override
    public String getLabel() {
        return label;
    }

    /** No automatic transition leaves these states. */
    public boolean isTerminal() {
        return this == FAILED || this == PUBLISHED;
    }
}
