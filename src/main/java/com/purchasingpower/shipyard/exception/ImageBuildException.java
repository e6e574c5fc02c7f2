package com.purchasingpower.shipyard.exception;

public class ImageBuildException extends ShipyardException {

    public ImageBuildException(String unit, String message) {
        super(unit, message);
    }

    public ImageBuildException(String unit, String message, Throwable cause) {
        super(unit, message, cause);
    }
}
