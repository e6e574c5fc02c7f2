package com.purchasingpower.shipyard.deploy;

import com.purchasingpower.shipyard.model.ImageReference;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * @param tags    image reference per artifact, keyed by the artifact's relative directory
 * @param pushed  relative directories of artifacts whose image was built and pushed in this run
 * @param failed  names of artifacts whose publish failed
 * @param aborted true when a failure stopped the run under fail-fast
 */
public record PublishOutcome(
        boolean success,
        boolean aborted,
        Map<String, ImageReference> tags,
        Set<String> pushed,
        List<String> failed
) {
}
