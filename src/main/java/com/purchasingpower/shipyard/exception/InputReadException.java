package com.purchasingpower.shipyard.exception;

/**
 * A declared input file could not be read for hashing. Fatal to the unit.
 */
public class InputReadException extends ShipyardException {

    public InputReadException(String unit, String message) {
        super(unit, message);
    }

    public InputReadException(String unit, String message, Throwable cause) {
        super(unit, message, cause);
    }
}
