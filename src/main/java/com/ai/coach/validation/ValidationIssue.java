package com.ai.coach.validation;

import lombok.Getter;

/**
 * One finding of the sequence validator. {@code messageId} is null for document-level findings.
 */
@Getter
public final class ValidationIssue {

    public enum Severity {
        ERROR,
        WARNING
    }

    private final Severity severity;
    private final Integer messageId;
    private final String description;

    private ValidationIssue(Severity severity, Integer messageId, String description) {
        this.severity = severity;
        this.messageId = messageId;
        this.description = description;
    }

    public static ValidationIssue error(Integer messageId, String description) {
        return new ValidationIssue(Severity.ERROR, messageId, description);
    }

    public static ValidationIssue warning(Integer messageId, String description) {
        return new ValidationIssue(Severity.WARNING, messageId, description);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return messageId == null ? description : "message " + messageId + ": " + description;
    }
}
