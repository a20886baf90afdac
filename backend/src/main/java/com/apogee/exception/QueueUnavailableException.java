package com.apogee.exception;

import lombok.Getter;

/** The job broker could not accept or report work. Fatal to the whole batch. */
@Getter
public class QueueUnavailableException extends RuntimeException {
    private final String queueName;

    public QueueUnavailableException(String queueName, String message, Throwable cause) {
        super(message, cause);
        this.queueName = queueName;
    }
}
