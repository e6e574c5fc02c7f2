package com.purchasingpower.shipyard.change;

import java.util.List;

/**
 * Outcome of one oracle consultation. {@code currentFingerprint} is always computed so callers can persist it.
 */
public record ChangeDecision(boolean needsProcessing, String currentFingerprint, List<String> reasons) {

    public ChangeDecision {
        reasons = List.copyOf(reasons);
    }
}
