package com.purchasingpower.shipyard.deploy;

import java.util.Map;

/**
 * Replaces artifact placeholders in a manifest document with concrete image references.
 */
public interface ManifestRewriter {

    /**
     * @param document        concatenated manifest document
     * @param imageReferences artifact directory path (as written in the manifests) to image reference
     */
    String rewrite(String document, Map<String, String> imageReferences);
}
