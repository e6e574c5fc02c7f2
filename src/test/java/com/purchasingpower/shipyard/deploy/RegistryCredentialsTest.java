package com.purchasingpower.shipyard.deploy;

import com.purchasingpower.shipyard.exception.InvalidAuthException;
import com.purchasingpower.shipyard.model.RegistryCredential;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Registry Credentials Tests")
class RegistryCredentialsTest {

    @Test
    @DisplayName("Should map user:pass to the default registry")
    void testParse_ShouldDefaultToDockerHub() {
        RegistryCredential credential = RegistryCredentials.parse(List.of("ci:secret")).credentialFor("docker.io");

        assertEquals("ci", credential.username());
        assertEquals("secret", credential.password());
    }

    @Test
    @DisplayName("Should accept a registry host with a port")
    void testParse_ShouldAcceptHostWithPort() {
        RegistryCredentials credentials = RegistryCredentials.parse(List.of("registry.local:5000:ci:secret"));

        RegistryCredential credential = credentials.credentialFor("registry.local:5000");

        assertEquals("registry.local:5000", credential.registryHost());
        assertEquals("ci", credential.username());
        assertEquals("secret", credential.password());
    }

    @Test
    @DisplayName("Should let a later entry for the same host win")
    void testParse_ShouldPreferLaterEntry() {
        RegistryCredentials credentials = RegistryCredentials.parse(List.of("ghcr.io:old:one", "ghcr.io:new:two", "ci:secret"));

        assertEquals(2, credentials.size());
        assertEquals("new", credentials.credentialFor("ghcr.io").username());
    }

    @Test
    @DisplayName("Should reject an unknown registry")
    void testCredentialFor_ShouldRejectUnknownHost() {
        RegistryCredentials credentials = RegistryCredentials.parse(List.of("ci:secret"));

        InvalidAuthException e = assertThrows(InvalidAuthException.class, () -> credentials.credentialFor("quay.io"));
        assertTrue(e.getMessage().contains("quay.io"));
    }

    @Test
    @DisplayName("Should reject an entry without a password separator")
    void testParse_ShouldRejectMalformedEntry() {
        assertThrows(InvalidAuthException.class, () -> RegistryCredentials.parse(List.of("justauser")));
    }

    @Test
    @DisplayName("Should never print the password")
    void testToString_ShouldHidePassword() {
        RegistryCredential credential = RegistryCredentials.parse(List.of("ci:hunter2")).credentialFor("docker.io");

        assertFalse(credential.toString().contains("hunter2"));
    }
}
