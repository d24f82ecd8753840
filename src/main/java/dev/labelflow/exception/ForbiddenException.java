package dev.labelflow.exception;

/** The actor lacks the role or ownership the operation requires. */
public class ForbiddenException extends WorkflowException {

    public ForbiddenException(String message) {
        super(message);
    }
}
