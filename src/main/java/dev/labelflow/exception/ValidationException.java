package dev.labelflow.exception;

/** The request cannot be applied as given: empty pool, non-member target, malformed decision. */
public class ValidationException extends WorkflowException {

    public ValidationException(String message) {
        super(message);
    }
}
