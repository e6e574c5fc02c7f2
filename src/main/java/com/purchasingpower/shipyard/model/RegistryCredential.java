package com.purchasingpower.shipyard.model;

public record RegistryCredential(String registryHost, String username, String password) {

    @Override
    public String toString() {
        return "RegistryCredential[" + registryHost + ", " + username + "]";
    }
}
