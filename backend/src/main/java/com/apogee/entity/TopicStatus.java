package com.apogee.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TopicStatus implements LabeledEnum {
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected"),
    PUBLISHED("published");

    private final String label;

    TopicStatus(String label) {
        this.label = label;
    }

    @JsonValue
    @Override
    public String getLabel() {
        return label;
    }
}
