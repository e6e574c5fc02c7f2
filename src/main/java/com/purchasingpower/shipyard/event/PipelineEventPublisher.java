package com.purchasingpower.shipyard.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fans each event out to all registered listeners.
 * A listener that throws is logged and skipped so that rendering can never fail a run.
 */
@Slf4j
@Component
public class PipelineEventPublisher {

    private final List<PipelineEventListener> listeners;

    public PipelineEventPublisher(List<PipelineEventListener> listeners) {
        this.listeners = new ArrayList<>(listeners);
    }

    public static PipelineEventPublisher of(PipelineEventListener... listeners) {
        return new PipelineEventPublisher(List.of(listeners));
    }

    public void publish(PipelineEvent event) {
        for (PipelineEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.warn("Listener {} failed on {} event", listener.getClass().getSimpleName(), event.getType(), e);
            }
        }
    }
}
