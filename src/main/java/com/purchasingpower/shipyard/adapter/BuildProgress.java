package com.purchasingpower.shipyard.adapter;

/**
 * One image build event: either a line of build output or the final image id.
 */
public record BuildProgress(String stream, String imageId) {
}
