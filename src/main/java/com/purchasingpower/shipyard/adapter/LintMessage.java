package com.purchasingpower.shipyard.adapter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A single lint finding. Severity 2 is an error, 1 a warning.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LintMessage(
        String ruleId,
        int severity,
        String message,
        int line,
        int column
) {

    public static final int SEVERITY_ERROR = 2;

    public boolean isBlocking() {
        return severity >= SEVERITY_ERROR;
    }
}
