package com.purchasingpower.shipyard.exception;

/**
 * No credentials configured for the registry host of an image.
 */
public class InvalidAuthException extends ShipyardException {

    public InvalidAuthException(String unit, String message) {
        super(unit, message);
    }

    public InvalidAuthException(String unit, String message, Throwable cause) {
        super(unit, message, cause);
    }
}
