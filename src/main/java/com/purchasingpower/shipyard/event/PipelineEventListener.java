package com.purchasingpower.shipyard.event;

/**
 * Receives pipeline events. Implementations are picked up by Spring and called synchronously,
 * in emission order.
 */
@FunctionalInterface
public interface PipelineEventListener {

    void onEvent(PipelineEvent event);
}
