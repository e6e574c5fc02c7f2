package com.purchasingpower.shipyard.exception;

/**
 * History lookup failed for a file. Always absorbed by the caller and treated as a change.
 */
public class DiffException extends ShipyardException {

    public DiffException(String unit, String message) {
        super(unit, message);
    }

    public DiffException(String unit, String message, Throwable cause) {
        super(unit, message, cause);
    }
}
