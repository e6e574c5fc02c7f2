package com.purchasingpower.shipyard.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class BundleException extends ShipyardException {

    private final List<String> errors;

    public BundleException(String unit, List<String> errors) {
        super(unit, "Bundling " + unit + " failed: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
}
