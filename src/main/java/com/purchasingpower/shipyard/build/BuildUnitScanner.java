package com.purchasingpower.shipyard.build;

import com.purchasingpower.shipyard.configuration.RunConfiguration;
import com.purchasingpower.shipyard.model.BuildUnit;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Finds every file named like the configured entry file below the build directory.
 */
@Component
public class BuildUnitScanner {

    public List<BuildUnit> scan(RunConfiguration config) {
        Path buildRoot = config.resolve(config.getBuildDir());
        if (!Files.isDirectory(buildRoot)) {
            return List.of();
        }

        try (Stream<Path> files = Files.walk(buildRoot)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().equals(config.getEntryFileName()))
                    .sorted()
                    .map(entry -> toUnit(config, buildRoot, entry))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot scan " + buildRoot, e);
        }
    }

    private static BuildUnit toUnit(RunConfiguration config, Path buildRoot, Path entry) {
        Path unitDir = buildRoot.relativize(entry.getParent());
        String relativeDir = unitDir.toString().replace('\\', '/');
        Path outputDir = config.resolve(config.getDistDir()).resolve(unitDir).normalize();

        return BuildUnit.builder()
                .name(unitName(config, relativeDir))
                .entryFile(entry)
                .relativeEntry(config.relativize(entry))
                .outputDir(outputDir)
                .relativeOutputDir(config.relativize(outputDir))
                .build();
    }

    static String unitName(RunConfiguration config, String relativeDir) {
        // an entry directly under the build root is named after the root itself
        return relativeDir.isEmpty() ? config.getBuildDir().replace('/', '-') : relativeDir.replace('/', '-');
    }
}
