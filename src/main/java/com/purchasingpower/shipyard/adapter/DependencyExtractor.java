package com.purchasingpower.shipyard.adapter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Computes the transitive file dependency graph of an entry file.
 */
public interface DependencyExtractor {

    /**
     * @param entryFile    absolute path of the entry file
     * @param bundlerConfig bundler configuration, used for alias resolution where supported
     * @return graph keyed by file path relative to the entry's directory; values are that file's
     *         direct dependencies, relative to the same directory. Non-source nodes may be present.
     */
    Map<String, List<String>> extract(Path entryFile, Path bundlerConfig) throws IOException;
}
