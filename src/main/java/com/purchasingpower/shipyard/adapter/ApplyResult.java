package com.purchasingpower.shipyard.adapter;

public record ApplyResult(int exitCode, String stdout, String stderr) {

    public boolean hasErrors() {
        return stderr != null && !stderr.isBlank();
    }
}
