package com.purchasingpower.shipyard.deploy;

import com.purchasingpower.shipyard.build.ArtifactStore;
import com.purchasingpower.shipyard.configuration.RunConfiguration;
import com.purchasingpower.shipyard.exception.ShipyardException;
import com.purchasingpower.shipyard.model.Artifact;
import com.purchasingpower.shipyard.model.PackageDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Locates built artifacts in the dist directory through their package descriptors.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArtifactScanner {

    private final ArtifactStore artifactStore;

    public List<Artifact> scan(RunConfiguration config) {
        Path distRoot = config.resolve(config.getDistDir());
        if (!Files.isDirectory(distRoot)) {
            return List.of();
        }

        List<Path> entries;
        try (Stream<Path> files = Files.walk(distRoot)) {
            entries = files
                    .filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().equals(config.getEntryFileName()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan " + distRoot, e);
        }

        List<Artifact> artifacts = new ArrayList<>();
        for (Path entry : entries) {
            Path directory = entry.getParent();
            Optional<PackageDescriptor> descriptor = readDescriptor(config, directory);
            if (descriptor.isEmpty()) {
                log.warn("Skipping {}: no {} next to it", config.relativize(entry), PackageDescriptor.FILE_NAME);
                continue;
            }
            artifacts.add(Artifact.builder()
                    .file(entry)
                    .relativeFile(config.relativize(entry))
                    .directory(directory)
                    .relativeDirectory(config.relativize(directory))
                    .descriptor(descriptor.get())
                    .build());
        }
        return artifacts;
    }

    private Optional<PackageDescriptor> readDescriptor(RunConfiguration config, Path directory) {
        try {
            return artifactStore.readDescriptor(directory);
        } catch (IOException e) {
            throw new ShipyardException(null, "Unreadable descriptor in " + config.relativize(directory) + ": " + e.getMessage(), e);
        }
    }
}
