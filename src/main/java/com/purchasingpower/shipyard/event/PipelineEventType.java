package com.purchasingpower.shipyard.event;

/**
 * Every event emitted by the build and deploy phases, in roughly the order they occur.
 */
public enum PipelineEventType {

    // build phase
    BUILDS_DISCOVERED,
    BUILD_DEPENDENCIES,
    LINT_FILE_ERROR,
    LINT_FILE,
    LINT_ERROR,
    LINT_PASSED,
    DIFF_FILE,
    DIFF_ERROR,
    FINGERPRINT_ERROR,
    BUILD_SKIP,
    BUILD_READY,
    BUILD_ERROR,
    BUILD_COMPLETE,
    BUILD_STATS,

    // deploy phase
    DEPLOYMENTS_DISCOVERED,
    IMAGE_TAG,
    IMAGE_EXISTS,
    IMAGE_BUILD_OUTPUT,
    IMAGE_BUILD_COMPLETE,
    IMAGE_PUSH_PROGRESS,
    IMAGE_PUSHED,
    DEPLOYMENT_ERROR,
    DEPLOYMENT_DEPENDENCIES,
    DEPLOYMENT_READY,
    DEPLOYMENT_SKIP,
    MANIFEST_DIFF,
    MANIFEST_RENDERED,
    APPLY_OUTPUT,
    DEPLOYMENT_STATS
}
