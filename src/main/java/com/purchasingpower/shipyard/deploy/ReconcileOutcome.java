package com.purchasingpower.shipyard.deploy;

import java.util.List;

/**
 * @param applied        true when a manifest document was sent to the cluster
 * @param dirtyFragments fragments that triggered the apply, relative to the working directory
 */
public record ReconcileOutcome(
        boolean success,
        boolean applied,
        List<String> deployed,
        List<String> skipped,
        List<String> dirtyFragments
) {
}
