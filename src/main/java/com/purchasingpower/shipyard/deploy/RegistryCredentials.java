package com.purchasingpower.shipyard.deploy;

import com.purchasingpower.shipyard.exception.InvalidAuthException;
import com.purchasingpower.shipyard.model.ImageReference;
import com.purchasingpower.shipyard.model.RegistryCredential;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry host to credential mapping, read-only once parsed.
 *
 * <p>Entries are {@code registry:user:pass} or {@code user:pass} for {@value ImageReference#DEFAULT_REGISTRY}.
 * User and password are the last two segments, so hosts with a port ({@code registry.local:5000:user:pass})
 * are accepted.
 */
public final class RegistryCredentials {

    private final Map<String, RegistryCredential> byHost;

    private RegistryCredentials(Map<String, RegistryCredential> byHost) {
        this.byHost = Collections.unmodifiableMap(byHost);
    }

    public static RegistryCredentials parse(List<String> entries) {
        Map<String, RegistryCredential> byHost = new LinkedHashMap<>();
        if (entries != null) {
            for (String entry : entries) {
                RegistryCredential credential = parseEntry(entry);
                byHost.put(credential.registryHost(), credential);
            }
        }
        return new RegistryCredentials(byHost);
    }

    private static RegistryCredential parseEntry(String entry) {
        String value = entry == null ? "" : entry.trim();
        int passwordSeparator = value.lastIndexOf(':');
        if (passwordSeparator <= 0) {
            throw new InvalidAuthException(null, "Malformed registry auth entry, expected [registry:]user:pass");
        }
        String password = value.substring(passwordSeparator + 1);
        String rest = value.substring(0, passwordSeparator);

        int userSeparator = rest.lastIndexOf(':');
        if (userSeparator < 0) {
            return new RegistryCredential(ImageReference.DEFAULT_REGISTRY, rest, password);
        }
        return new RegistryCredential(rest.substring(0, userSeparator), rest.substring(userSeparator + 1), password);
    }

    /**
     * @throws InvalidAuthException when no entry matches {@code registryHost}
     */
    public RegistryCredential credentialFor(String registryHost) {
        RegistryCredential credential = byHost.get(registryHost);
        if (credential == null) {
            throw new InvalidAuthException(null, "Invalid registry auth for " + registryHost);
        }
        return credential;
    }

    public int size() {
        return byHost.size();
    }
}
