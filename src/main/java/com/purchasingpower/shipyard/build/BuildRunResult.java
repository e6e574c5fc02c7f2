package com.purchasingpower.shipyard.build;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one build phase invocation. Per-unit details are delivered as events.
 */
@Value
@Builder
public class BuildRunResult {

    boolean success;

    /**
     * Every discovered unit, in discovery order.
     */
    List<String> units;

    List<String> built;

    List<String> skipped;

    List<String> failed;

    public String summary() {
        return String.format("Built %d, skipped %d, failed %d of %d units",
                built.size(), skipped.size(), failed.size(), units.size());
    }
}
