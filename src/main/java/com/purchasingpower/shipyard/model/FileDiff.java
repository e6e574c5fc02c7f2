package com.purchasingpower.shipyard.model;

public record FileDiff(String path, boolean changed, String currentHash, String previousHash) {
}
