package com.purchasingpower.shipyard.fingerprint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.shipyard.exception.InputReadException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.List;

/**
 * Content hashes for single files and for whole input sets.
 *
 * <p>Every hash is the SHA-256 hex digest truncated to {@value #HASH_LENGTH} characters. A set fingerprint
 * hashes the JSON array of its per-file hashes, with the files ordered by normalized absolute path, so the
 * result depends on file contents and set membership only. File metadata is never read.
 */
@Component
@RequiredArgsConstructor
public class Fingerprinter {

    public static final int HASH_LENGTH = 10;

    private final ObjectMapper objectMapper;

    public String fingerprint(Collection<Path> files) {
        List<String> hashes = files.stream()
                .map(file -> file.toAbsolutePath().normalize())
                .distinct()
                .sorted()
                .map(this::hashFile)
                .toList();
        try {
            return hashBytes(objectMapper.writeValueAsString(hashes).getBytes(StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize file hashes", e);
        }
    }

    /**
     * @throws InputReadException when the file is missing or unreadable
     */
    public String hashFile(Path file) {
        try {
            return hashBytes(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new InputReadException(null, "Cannot read input " + file + ": " + e, e);
        }
    }

    public String hashBytes(byte[] content) {
        return fullHash(content).substring(0, HASH_LENGTH);
    }

    /**
     * Untruncated SHA-256 hex digest, used where hashes are only compared within one run.
     */
    public String fullHash(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return toHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm unavailable", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder hex = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            hex.append(Character.forDigit((b >> 4) & 0xF, 16));
            hex.append(Character.forDigit(b & 0xF, 16));
        }
        return hex.toString();
    }
}
