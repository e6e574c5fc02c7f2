package com.purchasingpower.shipyard.adapter;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BundleReport {

    @Builder.Default
    List<String> errors = List.of();

    long durationMs;

    public boolean isSuccess() {
        return errors.isEmpty();
    }
}
