package com.purchasingpower.shipyard.adapter;

import java.util.List;

public record LintReport(String file, List<LintMessage> messages) {

    public LintReport {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public List<LintMessage> errors() {
        return messages.stream().filter(LintMessage::isBlocking).toList();
    }

    public boolean hasErrors() {
        return messages.stream().anyMatch(LintMessage::isBlocking);
    }
}
