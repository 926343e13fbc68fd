package com.delta.research.pipeline.service;

/**
 * A failure no retry can fix; the worker fails the job and the run without backoff.
 */
public class TerminalRunFailureException extends RuntimeException {
    private final String code;

    public TerminalRunFailureException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
