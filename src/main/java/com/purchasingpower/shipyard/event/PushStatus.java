package com.purchasingpower.shipyard.event;

import java.util.Locale;
import java.util.Optional;

/**
 * Registry push status, normalized from the free-form status strings the daemon streams.
 */
public enum PushStatus {

    PUSHING,
    PUSHED,
    LAYER_EXISTS;

    /**
     * Maps a raw push status to a known value. Anything else (Preparing, Waiting, digests) is empty.
     */
    public static Optional<PushStatus> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "pushing":
                return Optional.of(PUSHING);
            case "pushed":
                return Optional.of(PUSHED);
            case "layer already exists":
                return Optional.of(LAYER_EXISTS);
            default:
                return Optional.empty();
        }
    }

    public boolean isTerminal() {
        return this != PUSHING;
    }
}
