package com.purchasingpower.shipyard.exception;

/**
 * The cluster apply transport reported errors on its error stream.
 */
public class ApplyException extends ShipyardException {

    public ApplyException(String unit, String message) {
        super(unit, message);
    }

    public ApplyException(String unit, String message, Throwable cause) {
        super(unit, message, cause);
    }
}
