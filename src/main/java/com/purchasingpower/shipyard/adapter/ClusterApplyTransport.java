package com.purchasingpower.shipyard.adapter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Applies a manifest document to the cluster.
 */
public interface ClusterApplyTransport {

    ApplyResult apply(Path manifest) throws IOException;
}
