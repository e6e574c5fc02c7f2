package com.purchasingpower.shipyard.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class DockerProperties {

    /**
     * Docker daemon endpoint. Empty means the docker-java default (DOCKER_HOST or the local socket).
     */
    private String host;

    @NotBlank
    private String baseImage = "node:12-alpine";

    @NotBlank
    private String appDir = "/usr/src/app";

    private int maxConnections = 10;
}
