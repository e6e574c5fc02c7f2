package com.purchasingpower.shipyard.adapter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Follows relative ES module and CommonJS specifiers from the entry file.
 * Bare package specifiers are ignored and bundler aliases are not resolved.
 */
@Slf4j
@Service
public class ImportScanningDependencyExtractor implements DependencyExtractor {

    private static final Pattern SPECIFIER = Pattern.compile(
            "(?:\\bimport\\s+(?:[^'\"]*?\\s+from\\s+)?|\\bexport\\s+[^'\"]*?\\s+from\\s+|\\brequire\\s*\\(\\s*|\\bimport\\s*\\(\\s*)"
                    + "['\"]([^'\"]+)['\"]");

    private static final List<String> RESOLVE_SUFFIXES = List.of("", ".js", ".mjs", ".cjs", "/index.js");

    @Override
    public Map<String, List<String>> extract(Path entryFile, Path bundlerConfig) throws IOException {
        Path baseDir = entryFile.toAbsolutePath().normalize().getParent();
        Map<String, List<String>> graph = new LinkedHashMap<>();
        Deque<Path> pending = new ArrayDeque<>();
        pending.add(entryFile.toAbsolutePath().normalize());

        while (!pending.isEmpty()) {
            Path file = pending.poll();
            String key = relative(baseDir, file);
            if (graph.containsKey(key)) {
                continue;
            }

            List<String> dependencies = new ArrayList<>();
            graph.put(key, dependencies);

            if (!isScannable(file)) {
                continue;
            }

            String source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            Matcher matcher = SPECIFIER.matcher(source);
            while (matcher.find()) {
                String specifier = matcher.group(1);
                if (!specifier.startsWith("./") && !specifier.startsWith("../")) {
                    continue;
                }
                Optional<Path> resolved = resolve(file.getParent(), specifier);
                if (resolved.isEmpty()) {
                    log.debug("Unresolved specifier '{}' in {}", specifier, file);
                    continue;
                }
                String dependency = relative(baseDir, resolved.get());
                if (!dependencies.contains(dependency)) {
                    dependencies.add(dependency);
                }
                pending.add(resolved.get());
            }
        }

        return graph;
    }

    private static Optional<Path> resolve(Path dir, String specifier) {
        for (String suffix : RESOLVE_SUFFIXES) {
            Path candidate = dir.resolve(specifier + suffix).normalize();
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static boolean isScannable(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".js") || name.endsWith(".mjs") || name.endsWith(".cjs") || name.endsWith(".jsx");
    }

    private static String relative(Path baseDir, Path file) {
        return baseDir.relativize(file).toString().replace('\\', '/');
    }
}
