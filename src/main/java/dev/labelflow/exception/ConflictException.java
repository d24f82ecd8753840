package dev.labelflow.exception;

/** A state precondition does not hold (already submitted, project completed, duplicates). */
public class ConflictException extends WorkflowException {

    public ConflictException(String message) {
        super(message);
    }
}
