package com.purchasingpower.shipyard.adapter;

import java.io.IOException;

/**
 * Turns an entry file and its sources into a single artifact.
 */
public interface Bundler {

    BundleReport bundle(BundleRequest request) throws IOException;
}
