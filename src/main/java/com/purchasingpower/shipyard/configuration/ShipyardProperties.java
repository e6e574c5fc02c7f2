package com.purchasingpower.shipyard.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "shipyard")
public class ShipyardProperties {

    /**
     * Phase executed on startup: none, build or deploy.
     */
    @NotNull
    private Phase phase = Phase.NONE;

    /**
     * Repository root. Every other path is resolved against it.
     */
    @NotBlank(message = "Working directory is required")
    private String workingDir = ".";

    private boolean failFast = false;

    private boolean force = false;

    @NotBlank
    private String buildDir = "build";

    @NotBlank
    private String distDir = "dist";

    @NotBlank
    private String entryFileName = "main.js";

    @NotEmpty
    private List<String> sourceExtensions = new ArrayList<>(List.of(".js"));

    @NotBlank
    private String bundlerConfig = "webpack.config.js";

    @NotBlank
    private String lintConfig = ".eslintrc.json";

    @NotBlank
    private String manifestDir = "deploy";

    @NotBlank
    private String manifestExtension = ".yaml";

    /**
     * Target registry as "host/repository/path", e.g. "registry.example.com/team/services".
     */
    private String registry;

    /**
     * Entries of the form "registry:user:pass" or "user:pass" (docker.io).
     */
    private List<String> registryAuth = new ArrayList<>();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private DockerProperties docker = new DockerProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ToolProperties tools = new ToolProperties();

    public enum Phase {
        NONE,
        BUILD,
        DEPLOY
    }
}
