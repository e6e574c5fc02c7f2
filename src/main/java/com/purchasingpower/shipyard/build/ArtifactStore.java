package com.purchasingpower.shipyard.build;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.shipyard.model.PackageDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Durable per-unit state in the output directory: the fingerprint sidecar and the package descriptor.
 * Files are written to a temp sibling and moved into place, so readers see either the old or the new content.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArtifactStore {

    public static final String FINGERPRINT_FILE = "deps.sha256";

    private final ObjectMapper objectMapper;

    public Path fingerprintFile(Path outputDir) {
        return outputDir.resolve(FINGERPRINT_FILE);
    }

    public void writeFingerprint(Path outputDir, String fingerprint) throws IOException {
        writeAtomically(fingerprintFile(outputDir), fingerprint.getBytes(StandardCharsets.UTF_8));
    }

    public void writeDescriptor(Path outputDir, PackageDescriptor descriptor) throws IOException {
        writeAtomically(outputDir.resolve(PackageDescriptor.FILE_NAME), objectMapper.writeValueAsBytes(descriptor));
    }

    /**
     * @return the descriptor, or empty if none has been written yet
     * @throws IOException when the descriptor exists but cannot be read or parsed
     */
    public Optional<PackageDescriptor> readDescriptor(Path outputDir) throws IOException {
        try {
            byte[] content = Files.readAllBytes(outputDir.resolve(PackageDescriptor.FILE_NAME));
            return Optional.of(objectMapper.readValue(content, PackageDescriptor.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    void writeAtomically(Path target, byte[] content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);

        Path temp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported for {}, falling back to replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
