package com.purchasingpower.shipyard.change;

import com.purchasingpower.shipyard.model.RevisionPair;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything the oracle needs to decide whether one unit must be processed again.
 */
@Value
@Builder
public class ChangeQuery {

    String unit;

    Path workingDir;

    /**
     * Input files relative to the working directory.
     */
    List<String> inputs;

    /**
     * Persisted fingerprint sidecar; it may not exist.
     */
    Path fingerprintFile;

    /**
     * HEAD commit recorded by the last successful build, if any.
     */
    String lastBuiltRevision;

    RevisionPair revisions;

    boolean force;
}
