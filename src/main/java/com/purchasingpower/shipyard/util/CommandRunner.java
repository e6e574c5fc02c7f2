package com.purchasingpower.shipyard.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs an external command and captures stdout and stderr separately.
 * Both streams are redirected to temp files so a chatty process can never block on a full pipe.
 */
@Slf4j
@Component
public class CommandRunner {

    public CommandResult run(List<String> command, Path workingDir) throws IOException {
        return run(command, workingDir, null);
    }

    public CommandResult run(List<String> command, Path workingDir, String stdin) throws IOException {
        log.debug("Running {} in {}", command, workingDir);

        Path stdout = Files.createTempFile("shipyard-out", ".log");
        Path stderr = Files.createTempFile("shipyard-err", ".log");
        long startTime = System.currentTimeMillis();

        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.directory(workingDir.toFile());
            builder.redirectOutput(stdout.toFile());
            builder.redirectError(stderr.toFile());

            Process process = builder.start();

            try (OutputStream in = process.getOutputStream()) {
                if (stdin != null) {
                    in.write(stdin.getBytes(StandardCharsets.UTF_8));
                }
            }

            int exitCode = process.waitFor();
            long durationMs = System.currentTimeMillis() - startTime;

            log.debug("{} exited with {} in {}ms", command.get(0), exitCode, durationMs);

            return new CommandResult(
                    exitCode,
                    decode(stdout),
                    decode(stderr),
                    durationMs);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while running " + command.get(0), e);
        } finally {
            Files.deleteIfExists(stdout);
            Files.deleteIfExists(stderr);
        }
    }

    /**
     * Tools may print bytes that are not valid UTF-8; those are replaced instead of failing the read.
     */
    private static String decode(Path output) throws IOException {
        return new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
    }

    public record CommandResult(int exitCode, String stdout, String stderr, long durationMs) {

        public boolean isSuccess() {
            return exitCode == 0;
        }
    }
}
