package com.purchasingpower.shipyard.exception;

import lombok.Getter;

/**
 * Base type for every failure raised by the build and deploy phases.
 * Carries the logical unit name when the failure is scoped to a single unit.
 */
@Getter
public class ShipyardException extends RuntimeException {

    private final String unit;

    public ShipyardException(String unit, String message) {
        super(message);
        this.unit = unit;
    }

    public ShipyardException(String unit, String message, Throwable cause) {
        super(message, cause);
        this.unit = unit;
    }
}
