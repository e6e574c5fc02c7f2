package com.purchasingpower.shipyard.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * One buildable entry point, discovered fresh on every build run.
 */
@Value
@Builder
public class BuildUnit {

    /**
     * Logical name derived from the entry's directory, e.g. {@code svc-a} for {@code build/svc/a/main.js}.
     */
    String name;

    Path entryFile;

    /**
     * Entry path relative to the working directory.
     */
    String relativeEntry;

    Path outputDir;

    String relativeOutputDir;
}
