package com.purchasingpower.shipyard.build;

import com.purchasingpower.shipyard.adapter.BundleReport;
import com.purchasingpower.shipyard.adapter.BundleRequest;
import com.purchasingpower.shipyard.adapter.Bundler;
import com.purchasingpower.shipyard.adapter.DependencyExtractor;
import com.purchasingpower.shipyard.adapter.LintEngine;
import com.purchasingpower.shipyard.adapter.LintReport;
import com.purchasingpower.shipyard.change.ChangeDecision;
import com.purchasingpower.shipyard.change.ChangeOracle;
import com.purchasingpower.shipyard.change.ChangeQuery;
import com.purchasingpower.shipyard.change.HistoryDiffer;
import com.purchasingpower.shipyard.configuration.RunConfiguration;
import com.purchasingpower.shipyard.event.PipelineEvent;
import com.purchasingpower.shipyard.event.PipelineEventPublisher;
import com.purchasingpower.shipyard.event.PipelineEventType;
import com.purchasingpower.shipyard.exception.BundleException;
import com.purchasingpower.shipyard.exception.InputReadException;
import com.purchasingpower.shipyard.exception.LintException;
import com.purchasingpower.shipyard.exception.ShipyardException;
import com.purchasingpower.shipyard.fingerprint.Fingerprinter;
import com.purchasingpower.shipyard.model.BuildUnit;
import com.purchasingpower.shipyard.model.PackageDescriptor;
import com.purchasingpower.shipyard.model.RevisionPair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Build phase: for each discovered unit resolve inputs, lint, consult the {@link ChangeOracle},
 * bundle when needed and persist descriptor and fingerprint.
 *
 * <p>Units are processed strictly one after another. With fail-fast a failing unit ends the run at once;
 * otherwise the unit is recorded as failed and the run continues, still reporting failure at the end.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BuildPipeline {

    private final BuildUnitScanner scanner;
    private final DependencyExtractor dependencyExtractor;
    private final LintEngine lintEngine;
    private final Bundler bundler;
    private final ChangeOracle changeOracle;
    private final HistoryDiffer historyDiffer;
    private final Fingerprinter fingerprinter;
    private final ArtifactStore artifactStore;
    private final PipelineEventPublisher events;

    public BuildRunResult run(RunConfiguration config) {
        log.info("Starting build in {}", config.getWorkingDir());

        List<BuildUnit> units = scanner.scan(config);
        List<String> names = units.stream().map(BuildUnit::getName).toList();
        List<String> built = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        events.publish(PipelineEvent.builder()
                .type(PipelineEventType.BUILDS_DISCOVERED)
                .files(units.stream().map(BuildUnit::getRelativeEntry).toList())
                .build());

        RevisionPair revisions = historyDiffer.capture(config.getWorkingDir());

        for (BuildUnit unit : units) {
            try {
                if (buildUnit(config, unit, revisions)) {
                    built.add(unit.getName());
                } else {
                    skipped.add(unit.getName());
                }
            } catch (ShipyardException e) {
                failed.add(unit.getName());
                if (!(e instanceof LintException)) {
                    events.publish(PipelineEvent.error(PipelineEventType.BUILD_ERROR, unit.getName(), unit.getRelativeEntry(), e));
                }
                if (config.isFailFast()) {
                    log.error("Aborting build after failure of {} (fail-fast)", unit.getName());
                    return result(false, names, built, skipped, failed);
                }
            }
        }

        BuildRunResult result = result(failed.isEmpty(), names, built, skipped, failed);
        events.publish(PipelineEvent.builder()
                .type(PipelineEventType.BUILD_STATS)
                .files(names)
                .message(result.summary())
                .build());
        return result;
    }

    /**
     * @return true when the unit was built, false when it was skipped
     */
    private boolean buildUnit(RunConfiguration config, BuildUnit unit, RevisionPair revisions) {
        List<String> inputs = resolveInputs(config, unit);
        events.publish(PipelineEvent.builder()
                .type(PipelineEventType.BUILD_DEPENDENCIES)
                .unit(unit.getName())
                .file(unit.getRelativeEntry())
                .files(inputs)
                .build());

        lint(config, unit, inputs);

        ChangeDecision decision = changeOracle.decide(ChangeQuery.builder()
                .unit(unit.getName())
                .workingDir(config.getWorkingDir())
                .inputs(inputs)
                .fingerprintFile(artifactStore.fingerprintFile(unit.getOutputDir()))
                .lastBuiltRevision(lastBuiltRevision(unit).orElse(null))
                .revisions(revisions)
                .force(config.isForce())
                .build());

        if (!decision.needsProcessing()) {
            events.publish(PipelineEvent.of(PipelineEventType.BUILD_SKIP, unit.getName(), unit.getRelativeEntry()));
            return false;
        }

        log.debug("Rebuilding {}: {}", unit.getName(), decision.reasons());
        events.publish(PipelineEvent.of(PipelineEventType.BUILD_READY, unit.getName(), unit.getRelativeEntry()));

        BundleReport report = bundle(config, unit);
        if (!report.isSuccess()) {
            throw new BundleException(unit.getName(), report.getErrors());
        }

        persist(config, unit, decision.currentFingerprint(), revisions, report);
        return true;
    }

    private List<String> resolveInputs(RunConfiguration config, BuildUnit unit) {
        Map<String, List<String>> graph;
        try {
            graph = dependencyExtractor.extract(unit.getEntryFile(), config.resolve(config.getBundlerConfig()));
        } catch (IOException e) {
            throw new InputReadException(unit.getName(), "Cannot resolve dependencies of " + unit.getRelativeEntry() + ": " + e.getMessage(), e);
        }

        Path entryDir = unit.getEntryFile().getParent();
        Set<String> inputs = new LinkedHashSet<>();
        inputs.add(unit.getRelativeEntry());
        graph.keySet().stream()
                .filter(config::isSourceFile)
                .map(node -> config.relativize(entryDir.resolve(node)))
                .forEach(inputs::add);
        return List.copyOf(inputs);
    }

    private void lint(RunConfiguration config, BuildUnit unit, List<String> inputs) {
        Path lintConfig = config.resolve(config.getLintConfig());
        List<String> failedFiles = new ArrayList<>();
        int errorCount = 0;

        for (String input : inputs) {
            Path file = config.getWorkingDir().resolve(input);
            String content;
            try {
                content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new InputReadException(unit.getName(), "Cannot read " + input + ": " + e.getMessage(), e);
            }

            LintReport report;
            try {
                report = lintEngine.lint(lintConfig, content, file);
            } catch (IOException e) {
                throw new ShipyardException(unit.getName(), "Lint of " + input + " could not run: " + e.getMessage(), e);
            }

            if (report.hasErrors()) {
                failedFiles.add(input);
                errorCount += report.errors().size();
                events.publish(PipelineEvent.builder()
                        .type(PipelineEventType.LINT_FILE_ERROR)
                        .unit(unit.getName())
                        .file(input)
                        .lintMessages(report.errors())
                        .build());
                if (config.isFailFast()) {
                    throw new LintException(unit.getName(), failedFiles);
                }
                continue;
            }

            events.publish(PipelineEvent.of(PipelineEventType.LINT_FILE, unit.getName(), input));
        }

        if (!failedFiles.isEmpty()) {
            events.publish(PipelineEvent.builder()
                    .type(PipelineEventType.LINT_ERROR)
                    .unit(unit.getName())
                    .file(unit.getRelativeEntry())
                    .files(failedFiles)
                    .errors(List.of(errorCount + " lint errors in " + failedFiles.size() + " files"))
                    .build());
            throw new LintException(unit.getName(), failedFiles);
        }

        events.publish(PipelineEvent.builder()
                .type(PipelineEventType.LINT_PASSED)
                .unit(unit.getName())
                .file(unit.getRelativeEntry())
                .files(inputs)
                .build());
    }

    private BundleReport bundle(RunConfiguration config, BuildUnit unit) {
        BundleRequest request = new BundleRequest(
                config.resolve(config.getBundlerConfig()),
                unit.getEntryFile(),
                unit.getOutputDir(),
                config.getEntryFileName());
        try {
            return bundler.bundle(request);
        } catch (IOException e) {
            throw new BundleException(unit.getName(), List.of("Bundler could not run: " + e.getMessage()));
        }
    }

    private void persist(RunConfiguration config, BuildUnit unit, String fingerprint, RevisionPair revisions, BundleReport report) {
        Path artifact = unit.getOutputDir().resolve(config.getEntryFileName());
        String version = fingerprinter.hashFile(artifact);

        PackageDescriptor descriptor = PackageDescriptor.builder()
                .name(unit.getName())
                .version(version)
                .deps(fingerprint)
                .revision(revisions.head())
                .build();

        try {
            // descriptor first: a crash before the sidecar is replaced leaves a stale fingerprint, which only forces a rebuild
            artifactStore.writeDescriptor(unit.getOutputDir(), descriptor);
            artifactStore.writeFingerprint(unit.getOutputDir(), fingerprint);
        } catch (IOException e) {
            throw new ShipyardException(unit.getName(), "Cannot persist build state for " + unit.getName() + ": " + e.getMessage(), e);
        }

        events.publish(PipelineEvent.builder()
                .type(PipelineEventType.BUILD_COMPLETE)
                .unit(unit.getName())
                .file(unit.getRelativeEntry())
                .hash(fingerprint)
                .version(version)
                .durationMs(report.getDurationMs())
                .build());
    }

    private Optional<String> lastBuiltRevision(BuildUnit unit) {
        try {
            return artifactStore.readDescriptor(unit.getOutputDir()).map(PackageDescriptor::getRevision);
        } catch (IOException e) {
            log.warn("Ignoring unreadable descriptor in {}: {}", unit.getRelativeOutputDir(), e.getMessage());
            return Optional.empty();
        }
    }

    private static BuildRunResult result(boolean success, List<String> units, List<String> built,
                                         List<String> skipped, List<String> failed) {
        return BuildRunResult.builder()
                .success(success)
                .units(units)
                .built(List.copyOf(built))
                .skipped(List.copyOf(skipped))
                .failed(List.copyOf(failed))
                .build();
    }
}
