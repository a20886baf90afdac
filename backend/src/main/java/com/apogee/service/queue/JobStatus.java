package com.apogee.service.queue;

import com.apogee.entity.LabeledEnum;

/** Lifecycle states a worker writes into the {@code status} field of a job hash. */
public enum JobStatus implements LabeledEnum {
    QUEUED("queued"),
    DEFERRED("deferred"),
    SCHEDULED("scheduled"),
    STARTED("started"),
    FINISHED("finished"),
    FAILED("failed"),
    STOPPED("stopped"),
    CANCELED("canceled");

    private final String label;

    JobStatus(String label) {
        this.label = label;
    }

    @Override
    public String getLabel() {
        return label;
    }

    public boolean isTerminal() {
        return this == FINISHED || this == FAILED || this == STOPPED || this == CANCELED;
    }
}
