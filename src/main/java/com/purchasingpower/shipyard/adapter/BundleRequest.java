package com.purchasingpower.shipyard.adapter;

import java.nio.file.Path;

/**
 * Merged bundler configuration for one unit: the base config file plus the per-unit output and entry.
 */
public record BundleRequest(
        Path configFile,
        Path entryFile,
        Path outputDir,
        String outputFileName
) {
}
