package com.ai.coach.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public final class ValidationResult {

    private final String sequenceId;
    private final List<ValidationIssue> issues;

    public ValidationResult(String sequenceId, List<ValidationIssue> issues) {
        this.sequenceId = sequenceId;
        this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
    }

    public String getSequenceId() {
        return sequenceId;
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }

    public List<ValidationIssue> getErrors() {
        return issues.stream().filter(ValidationIssue::isError).collect(Collectors.toList());
    }

    public List<ValidationIssue> getWarnings() {
        return issues.stream().filter(i -> !i.isError()).collect(Collectors.toList());
    }

    public boolean isValid() {
        return issues.stream().noneMatch(ValidationIssue::isError);
    }

    public String summary() {
        return getErrors().stream().map(ValidationIssue::toString).collect(Collectors.joining("; "));
    }
}
