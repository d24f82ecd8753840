package dev.labelflow.exception;

import java.util.UUID;

/** Project, member, image, assignment or submission is absent. */
public class NotFoundException extends WorkflowException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String kind, UUID id) {
        return new NotFoundException("%s not found: %s".formatted(kind, id));
    }
}
