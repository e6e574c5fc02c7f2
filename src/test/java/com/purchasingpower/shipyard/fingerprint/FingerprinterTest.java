package com.purchasingpower.shipyard.fingerprint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.shipyard.exception.InputReadException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Fingerprinter Tests")
class FingerprinterTest {

    @TempDir
    Path dir;

    private Fingerprinter fingerprinter;

    @BeforeEach
    void setUp() {
        fingerprinter = new Fingerprinter(new ObjectMapper());
    }

    @Test
    @DisplayName("Should hash empty content to the truncated SHA-256 of nothing")
    void testHashBytes_ShouldTruncateDigest() {
        String hash = fingerprinter.hashBytes(new byte[0]);

        assertEquals("e3b0c44298", hash);
        assertEquals(Fingerprinter.HASH_LENGTH, hash.length());
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                fingerprinter.fullHash(new byte[0]));
    }

    @Test
    @DisplayName("Should ignore input order and duplicates")
    void testFingerprint_ShouldBeOrderIndependent() throws Exception {
        Path a = write("a.js", "export const a = 1;\n");
        Path b = write("lib/b.js", "export const b = 2;\n");

        String forward = fingerprinter.fingerprint(List.of(a, b));
        String reversed = fingerprinter.fingerprint(List.of(b, a, b));

        assertEquals(forward, reversed);
        assertEquals(Fingerprinter.HASH_LENGTH, forward.length());
    }

    @Test
    @DisplayName("Should not depend on file metadata")
    void testFingerprint_ShouldIgnoreModificationTime() throws Exception {
        Path a = write("a.js", "export const a = 1;\n");
        String before = fingerprinter.fingerprint(List.of(a));

        Files.setLastModifiedTime(a, FileTime.from(Instant.parse("2001-01-01T00:00:00Z")));

        assertEquals(before, fingerprinter.fingerprint(List.of(a)));
    }

    @Test
    @DisplayName("Should change when any input content changes")
    void testFingerprint_ShouldReflectContent() throws Exception {
        Path a = write("a.js", "export const a = 1;\n");
        Path b = write("b.js", "export const b = 2;\n");
        String before = fingerprinter.fingerprint(List.of(a, b));

        write("b.js", "export const b = 3;\n");

        assertNotEquals(before, fingerprinter.fingerprint(List.of(a, b)));
    }

    @Test
    @DisplayName("Should change when the input set changes")
    void testFingerprint_ShouldReflectMembership() throws Exception {
        Path a = write("a.js", "same\n");
        Path b = write("b.js", "same\n");

        assertNotEquals(fingerprinter.fingerprint(List.of(a)), fingerprinter.fingerprint(List.of(a, b)));
    }

    @Test
    @DisplayName("Should fail with InputReadException on a missing input")
    void testFingerprint_ShouldFailOnMissingFile() {
        Path missing = dir.resolve("missing.js");

        assertThrows(InputReadException.class, () -> fingerprinter.fingerprint(List.of(missing)));
    }

    private Path write(String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
