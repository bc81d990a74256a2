package com.deepansh.toolplanner.exception;

/**
 * Raised when an incoming tool-call batch cannot be turned into {@code ToolCall}s,
 * e.g. unparseable argument JSON.
 */
public class PlanningException extends RuntimeException {

    public PlanningException(String message) {
        super(message);
    }

    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
