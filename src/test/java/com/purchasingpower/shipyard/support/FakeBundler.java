package com.purchasingpower.shipyard.support;

import com.purchasingpower.shipyard.adapter.BundleReport;
import com.purchasingpower.shipyard.adapter.BundleRequest;
import com.purchasingpower.shipyard.adapter.Bundler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Concatenates the sources next to the entry file into the output file, so the artifact changes whenever
 * a dependency does. Entries containing {@value #MARKER} fail to bundle.
 */
public class FakeBundler implements Bundler {

    public static final String MARKER = "BUNDLE_ERROR";

    private final List<BundleRequest> requests = new ArrayList<>();

    @Override
    public BundleReport bundle(BundleRequest request) throws IOException {
        requests.add(request);
        String source = new String(Files.readAllBytes(request.entryFile()), StandardCharsets.UTF_8);
        if (source.contains(MARKER)) {
            return BundleReport.builder().errors(List.of("Module parse failed: " + request.entryFile().getFileName())).build();
        }
        StringBuilder bundle = new StringBuilder("/* bundled */\n");
        try (Stream<Path> files = Files.list(request.entryFile().getParent())) {
            for (Path file : files.filter(Files::isRegularFile).sorted().toList()) {
                bundle.append(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
            }
        }
        Files.createDirectories(request.outputDir());
        Files.writeString(request.outputDir().resolve(request.outputFileName()), bundle.toString(), StandardCharsets.UTF_8);
        return BundleReport.builder().durationMs(5).build();
    }

    public List<BundleRequest> requests() {
        return List.copyOf(requests);
    }

    public void reset() {
        requests.clear();
    }
}
