package com.purchasingpower.shipyard.exception;

import lombok.Getter;

import java.util.List;

/**
 * Blocking (severity 2) lint findings for one unit.
 */
@Getter
public class LintException extends ShipyardException {

    private final List<String> files;

    public LintException(String unit, List<String> files) {
        super(unit, "Lint errors in " + files.size() + " file(s) of " + unit);
        this.files = List.copyOf(files);
    }
}
