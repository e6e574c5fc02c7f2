package com.purchasingpower.shipyard.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * A built artifact located on disk together with its descriptor.
 */
@Value
@Builder
public class Artifact {

    Path file;

    /**
     * Artifact path relative to the working directory.
     */
    String relativeFile;

    Path directory;

    /**
     * Directory relative to the working directory. Manifest fragments reference artifacts by this path.
     */
    String relativeDirectory;

    PackageDescriptor descriptor;

    public String getName() {
        return descriptor.getName();
    }

    public String getVersion() {
        return descriptor.getVersion();
    }
}
