package com.purchasingpower.shipyard.deploy;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one deploy phase invocation.
 */
@Value
@Builder
public class DeployRunResult {

    boolean success;

    List<String> artifacts;

    /**
     * Artifacts whose image was built and pushed in this run.
     */
    List<String> pushed;

    List<String> deployed;

    List<String> skipped;

    List<String> failed;

    boolean applied;

    public String summary() {
        return String.format("Pushed %d, deployed %d, skipped %d, failed %d of %d artifacts",
                pushed.size(), deployed.size(), skipped.size(), failed.size(), artifacts.size());
    }
}
