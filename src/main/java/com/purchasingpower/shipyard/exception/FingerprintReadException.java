package com.purchasingpower.shipyard.exception;

/**
 * The persisted fingerprint exists but could not be read.
 */
public class FingerprintReadException extends ShipyardException {

    public FingerprintReadException(String unit, String message) {
        super(unit, message);
    }

    public FingerprintReadException(String unit, String message, Throwable cause) {
        super(unit, message, cause);
    }
}
