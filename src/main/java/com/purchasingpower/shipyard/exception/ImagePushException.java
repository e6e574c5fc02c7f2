package com.purchasingpower.shipyard.exception;

public class ImagePushException extends ShipyardException {

    public ImagePushException(String unit, String message) {
        super(unit, message);
    }

    public ImagePushException(String unit, String message, Throwable cause) {
        super(unit, message, cause);
    }
}
