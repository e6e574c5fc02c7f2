package com.purchasingpower.shipyard.model;

import java.util.List;
import java.util.Optional;

/**
 * The two most recent commits, captured once per run. Empty when there is no history to compare.
 */
public record RevisionPair(String head, String previous) {

    private static final RevisionPair NONE = new RevisionPair(null, null);

    public static RevisionPair none() {
        return NONE;
    }

    public static RevisionPair of(List<String> commits) {
        if (commits == null || commits.size() < 2) {
            return new RevisionPair(commits == null || commits.isEmpty() ? null : commits.get(0), null);
        }
        return new RevisionPair(commits.get(0), commits.get(1));
    }

    public boolean isComplete() {
        return head != null && previous != null;
    }

    public Optional<String> headRevision() {
        return Optional.ofNullable(head);
    }
}
