package com.purchasingpower.shipyard.adapter;

public enum ProbeResult {
    FOUND,
    NOT_FOUND
}
