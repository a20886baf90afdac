package com.apogee.exception;

import lombok.Getter;

@Getter
public class IllegalStatusTransitionException extends RuntimeException {
    private final String entityType;
    private final Object entityId;
    private final Enum<?> fromStatus;
    private final Enum<?> toStatus;

    public IllegalStatusTransitionException(
            String entityType, Object entityId, Enum<?> fromStatus, Enum<?> toStatus) {
        super(
                String.format(
                        "Invalid state transition from %s to %s for %s %s",
                        fromStatus, toStatus, entityType, entityId));
        this.entityType = entityType;
        this.entityId = entityId;
        this.fromStatus = fromStatus;
        this.toStatus = toStatus;
    }
}
