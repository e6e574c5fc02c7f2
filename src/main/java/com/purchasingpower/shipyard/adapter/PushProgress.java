package com.purchasingpower.shipyard.adapter;

/**
 * One image push event as reported by the daemon, keyed by layer id.
 */
public record PushProgress(String id, String status, Long current, Long total) {
}
