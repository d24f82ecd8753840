package dev.labelflow.exception;

/**
 * Base type for caller-visible workflow failures. Each subtype maps to one
 * HTTP status in {@link GlobalExceptionHandler}.
 */
public abstract class WorkflowException extends RuntimeException {

    protected WorkflowException(String message) {
        super(message);
    }
}
