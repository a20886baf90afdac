package com.apogee.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentRunStatus implements LabeledEnum {
    SUCCESS("success"),
    FAILED("failed"),
    RETRY("retry");

    private final String label;

    AgentRunStatus(String label) {
        this.label = label;
    }

    @JsonValue
    @Override
    public String getLabel() {
        return label;
    }
}
