package com.purchasingpower.shipyard.model;

import java.util.Objects;

/**
 * Fully qualified image tag derived from an artifact's identity and content version.
 * Equal artifacts always yield equal references.
 */
public record ImageReference(
        String registryHost,
        String repository,
        String name,
        String version
) {

    public static final String DEFAULT_REGISTRY = "docker.io";

    public ImageReference {
        Objects.requireNonNull(registryHost, "registryHost");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        repository = repository == null ? "" : repository;
    }

    /**
     * Builds a reference from a registry target such as {@code registry.local:5000/team/apps}.
     * The first path segment is the host, the remainder the repository.
     */
    public static ImageReference of(String registry, String name, String version) {
        String target = registry == null || registry.isBlank() ? DEFAULT_REGISTRY : registry.trim();
        while (target.endsWith("/")) {
            target = target.substring(0, target.length() - 1);
        }
        int slash = target.indexOf('/');
        String host = slash < 0 ? target : target.substring(0, slash);
        String repository = slash < 0 ? "" : target.substring(slash + 1);
        return new ImageReference(host, repository, name, version);
    }

    /**
     * Reference without the tag, e.g. {@code registry.local:5000/team/apps/svc-a}.
     */
    public String repositoryName() {
        return repository.isEmpty()
                ? registryHost + "/" + name
                : registryHost + "/" + repository + "/" + name;
    }

    @Override
    public String toString() {
        return repositoryName() + ":" + version;
    }
}
