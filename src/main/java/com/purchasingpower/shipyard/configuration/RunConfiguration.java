package com.purchasingpower.shipyard.configuration;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable settings for one phase invocation.
 * Built from {@link ShipyardProperties} at the start of a run and passed down explicitly.
 */
@Value
@Builder(toBuilder = true)
public class RunConfiguration {

    Path workingDir;

    boolean failFast;

    boolean force;

    @Builder.Default
    String buildDir = "build";

    @Builder.Default
    String distDir = "dist";

    @Builder.Default
    String entryFileName = "main.js";

    @Builder.Default
    List<String> sourceExtensions = List.of(".js");

    @Builder.Default
    String bundlerConfig = "webpack.config.js";

    @Builder.Default
    String lintConfig = ".eslintrc.json";

    @Builder.Default
    String manifestDir = "deploy";

    @Builder.Default
    String manifestExtension = ".yaml";

    String registry;

    @Builder.Default
    List<String> registryAuth = List.of();

    @Builder.Default
    String baseImage = "node:12-alpine";

    @Builder.Default
    String appDir = "/usr/src/app";

    public static RunConfiguration from(ShipyardProperties props) {
        return RunConfiguration.builder()
                .workingDir(Path.of(props.getWorkingDir()).toAbsolutePath().normalize())
                .failFast(props.isFailFast())
                .force(props.isForce())
                .buildDir(props.getBuildDir())
                .distDir(props.getDistDir())
                .entryFileName(props.getEntryFileName())
                .sourceExtensions(List.copyOf(props.getSourceExtensions()))
                .bundlerConfig(props.getBundlerConfig())
                .lintConfig(props.getLintConfig())
                .manifestDir(props.getManifestDir())
                .manifestExtension(props.getManifestExtension())
                .registry(props.getRegistry())
                .registryAuth(List.copyOf(props.getRegistryAuth()))
                .baseImage(props.getDocker().getBaseImage())
                .appDir(props.getDocker().getAppDir())
                .build();
    }

    public Path resolve(String relative) {
        return workingDir.resolve(relative).normalize();
    }

    /**
     * Path relative to the working directory, always with forward slashes.
     */
    public String relativize(Path path) {
        return workingDir.relativize(path.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    public boolean isSourceFile(String path) {
        return sourceExtensions.stream().anyMatch(path::endsWith);
    }
}
