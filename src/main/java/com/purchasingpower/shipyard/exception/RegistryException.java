package com.purchasingpower.shipyard.exception;

/**
 * Registry call failed for a reason other than a missing image.
 */
public class RegistryException extends ShipyardException {

    public RegistryException(String unit, String message) {
        super(unit, message);
    }

    public RegistryException(String unit, String message, Throwable cause) {
        super(unit, message, cause);
    }
}
