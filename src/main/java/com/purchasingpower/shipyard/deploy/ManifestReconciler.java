package com.purchasingpower.shipyard.deploy;

import com.purchasingpower.shipyard.adapter.ApplyResult;
import com.purchasingpower.shipyard.adapter.ClusterApplyTransport;
import com.purchasingpower.shipyard.change.HistoryDiffer;
import com.purchasingpower.shipyard.configuration.RunConfiguration;
import com.purchasingpower.shipyard.event.PipelineEvent;
import com.purchasingpower.shipyard.event.PipelineEventPublisher;
import com.purchasingpower.shipyard.event.PipelineEventType;
import com.purchasingpower.shipyard.exception.ApplyException;
import com.purchasingpower.shipyard.exception.DiffException;
import com.purchasingpower.shipyard.exception.ShipyardException;
import com.purchasingpower.shipyard.model.Artifact;
import com.purchasingpower.shipyard.model.FileDiff;
import com.purchasingpower.shipyard.model.ImageReference;
import com.purchasingpower.shipyard.model.RevisionPair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Decides which manifest fragments are dirty and, if any are, applies the full rewritten manifest set.
 *
 * <p>A fragment is dirty when it references an artifact whose image was pushed in this run, when its own
 * content differs between the two most recent commits (or that cannot be determined), or when the run is forced.
 * Fragments that reference an artifact whose image failed to publish are never applied.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManifestReconciler {

    static final String DOCUMENT_SEPARATOR = "---";

    private static final Pattern EMPTY_DOCUMENT = Pattern.compile(DOCUMENT_SEPARATOR + "\\r?\\n" + DOCUMENT_SEPARATOR);

    private final ManifestRewriter rewriter;
    private final HistoryDiffer historyDiffer;
    private final ClusterApplyTransport applyTransport;
    private final PipelineEventPublisher events;

    /**
     * @param failed names of artifacts whose image could not be published; fragments that reference one of them
     *               are withheld from the applied document
     */
    public ReconcileOutcome reconcile(RunConfiguration config, List<Artifact> artifacts, Map<String, ImageReference> tags,
                                      Set<String> pushed, Collection<String> failed, RevisionPair revisions) {
        Map<String, String> fragments = readFragments(config);
        Set<String> withheld = withholdFragments(artifacts, fragments, failed);
        Set<String> dirty = new LinkedHashSet<>();
        List<String> deployed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (Artifact artifact : artifacts) {
            List<String> dependencies = fragments.entrySet().stream()
                    .filter(fragment -> fragment.getValue().contains(artifact.getRelativeDirectory()))
                    .map(Map.Entry::getKey)
                    .toList();

            events.publish(PipelineEvent.builder()
                    .type(PipelineEventType.DEPLOYMENT_DEPENDENCIES)
                    .unit(artifact.getName())
                    .file(artifact.getRelativeFile())
                    .files(dependencies)
                    .build());

            if (failed.contains(artifact.getName())) {
                continue;
            }
            if (config.isForce() || pushed.contains(artifact.getRelativeDirectory())) {
                dependencies.stream().filter(fragment -> !withheld.contains(fragment)).forEach(dirty::add);
                deployed.add(artifact.getName());
                events.publish(PipelineEvent.of(PipelineEventType.DEPLOYMENT_READY, artifact.getName(), artifact.getRelativeFile()));
            } else {
                skipped.add(artifact.getName());
                events.publish(PipelineEvent.of(PipelineEventType.DEPLOYMENT_SKIP, artifact.getName(), artifact.getRelativeFile()));
            }
        }

        for (String fragment : fragments.keySet()) {
            if (withheld.contains(fragment)) {
                continue;
            }
            if (config.isForce() || changedInHistory(config, revisions, fragment)) {
                dirty.add(fragment);
            }
        }

        if (dirty.isEmpty()) {
            log.info("No manifest changes to apply");
            List<String> all = artifacts.stream()
                    .map(Artifact::getName)
                    .filter(name -> !failed.contains(name))
                    .toList();
            return new ReconcileOutcome(true, false, List.of(), all, List.of());
        }

        log.debug("Dirty manifest fragments: {}", dirty);
        Map<String, String> applicable = new LinkedHashMap<>(fragments);
        applicable.keySet().removeAll(withheld);
        String document = render(applicable, tags);
        boolean applied = apply(config, document);
        return new ReconcileOutcome(applied, applied, deployed, skipped, List.copyOf(dirty));
    }

    private Set<String> withholdFragments(List<Artifact> artifacts, Map<String, String> fragments, Collection<String> failed) {
        Set<String> withheld = new LinkedHashSet<>();
        for (Artifact artifact : artifacts) {
            if (!failed.contains(artifact.getName())) {
                continue;
            }
            fragments.forEach((fragment, content) -> {
                if (content.contains(artifact.getRelativeDirectory())) {
                    withheld.add(fragment);
                }
            });
        }
        if (!withheld.isEmpty()) {
            log.warn("Withholding manifests that reference unpublished images: {}", withheld);
        }
        return withheld;
    }

    /**
     * Concatenates every fragment behind a document separator, rewrites artifact paths to image references
     * and collapses empty documents left by fragments that already start with a separator.
     */
    String render(Map<String, String> fragments, Map<String, ImageReference> tags) {
        StringBuilder document = new StringBuilder();
        for (String content : fragments.values()) {
            document.append('\n').append(DOCUMENT_SEPARATOR).append('\n').append(content);
        }

        Map<String, String> replacements = new LinkedHashMap<>();
        tags.forEach((directory, reference) -> replacements.put(directory, reference.toString()));

        return collapseEmptyDocuments(rewriter.rewrite(document.toString(), replacements));
    }

    static String collapseEmptyDocuments(String document) {
        String previous;
        String current = document;
        do {
            previous = current;
            current = EMPTY_DOCUMENT.matcher(previous).replaceAll(DOCUMENT_SEPARATOR);
        } while (!current.equals(previous));
        return current;
    }

    private boolean changedInHistory(RunConfiguration config, RevisionPair revisions, String fragment) {
        try {
            FileDiff diff = historyDiffer.diff(config.getWorkingDir(), revisions, fragment);
            events.publish(PipelineEvent.builder()
                    .type(PipelineEventType.MANIFEST_DIFF)
                    .file(fragment)
                    .changed(diff.changed())
                    .currentHash(diff.currentHash())
                    .previousHash(diff.previousHash())
                    .build());
            return diff.changed();
        } catch (DiffException e) {
            events.publish(PipelineEvent.error(PipelineEventType.DIFF_ERROR, null, fragment, e));
            return true;
        }
    }

    private boolean apply(RunConfiguration config, String document) {
        Path manifest = null;
        try {
            manifest = Files.createTempFile("shipyard-manifest", config.getManifestExtension());
            Files.writeString(manifest, document, StandardCharsets.UTF_8);

            events.publish(PipelineEvent.builder()
                    .type(PipelineEventType.MANIFEST_RENDERED)
                    .message(document)
                    .build());

            ApplyResult result = applyTransport.apply(manifest);
            if (result.hasErrors()) {
                throw new ApplyException(null, result.stderr().trim());
            }

            result.stdout().trim().lines()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .forEach(line -> events.publish(PipelineEvent.builder()
                            .type(PipelineEventType.APPLY_OUTPUT)
                            .message(line)
                            .build()));
            return true;

        } catch (IOException | ShipyardException e) {
            events.publish(PipelineEvent.error(PipelineEventType.DEPLOYMENT_ERROR, null, null, e));
            return false;
        } finally {
            deleteQuietly(manifest);
        }
    }

    private Map<String, String> readFragments(RunConfiguration config) {
        Path manifestRoot = config.resolve(config.getManifestDir());
        Map<String, String> fragments = new LinkedHashMap<>();
        if (!Files.isDirectory(manifestRoot)) {
            return fragments;
        }

        try (Stream<Path> files = Files.walk(manifestRoot)) {
            for (Path file : files.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(config.getManifestExtension()))
                    .sorted()
                    .toList()) {
                fragments.put(config.relativize(file), new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read manifests in " + manifestRoot, e);
        }
        return fragments;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete temporary manifest: {}", file, e);
        }
    }
}
