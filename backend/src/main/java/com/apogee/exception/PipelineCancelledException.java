package com.apogee.exception;

/** The stop signal fired while the pipeline was waiting. Remote jobs keep running. */
public class PipelineCancelledException extends RuntimeException {

    public PipelineCancelledException(String message) {
        super(message);
    }
}
