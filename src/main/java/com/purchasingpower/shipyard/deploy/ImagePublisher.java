package com.purchasingpower.shipyard.deploy;

import com.purchasingpower.shipyard.adapter.BuildProgress;
import com.purchasingpower.shipyard.adapter.ContainerRegistryClient;
import com.purchasingpower.shipyard.adapter.ProbeResult;
import com.purchasingpower.shipyard.adapter.PushProgress;
import com.purchasingpower.shipyard.configuration.RunConfiguration;
import com.purchasingpower.shipyard.event.PipelineEvent;
import com.purchasingpower.shipyard.event.PipelineEventPublisher;
import com.purchasingpower.shipyard.event.PipelineEventType;
import com.purchasingpower.shipyard.event.PushStatus;
import com.purchasingpower.shipyard.exception.ImageBuildException;
import com.purchasingpower.shipyard.exception.ShipyardException;
import com.purchasingpower.shipyard.model.Artifact;
import com.purchasingpower.shipyard.model.ImageReference;
import com.purchasingpower.shipyard.model.RegistryCredential;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Makes sure every artifact's image exists at the registry: probe first, build and push only when absent.
 *
 * <p>Image references are derived from the descriptor's name and content version, so an unchanged artifact
 * always probes as present and is never rebuilt or pushed twice.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImagePublisher {

    private final ContainerRegistryClient registryClient;
    private final PipelineEventPublisher events;

    /**
     * @throws com.purchasingpower.shipyard.exception.InvalidAuthException when the registry has no credential;
     *         raised before any registry call
     */
    public PublishOutcome publish(RunConfiguration config, List<Artifact> artifacts, RegistryCredentials credentials) {
        Map<String, ImageReference> tags = new LinkedHashMap<>();
        Set<String> pushed = new LinkedHashSet<>();
        List<String> failed = new ArrayList<>();

        if (artifacts.isEmpty()) {
            return new PublishOutcome(true, false, tags, pushed, failed);
        }

        for (Artifact artifact : artifacts) {
            tags.put(artifact.getRelativeDirectory(),
                    ImageReference.of(config.getRegistry(), artifact.getName(), artifact.getVersion()));
        }
        String registryHost = tags.values().iterator().next().registryHost();
        RegistryCredential credential = credentials.credentialFor(registryHost);

        for (Artifact artifact : artifacts) {
            ImageReference reference = tags.get(artifact.getRelativeDirectory());
            events.publish(PipelineEvent.builder()
                    .type(PipelineEventType.IMAGE_TAG)
                    .unit(artifact.getName())
                    .file(artifact.getRelativeFile())
                    .tag(reference.toString())
                    .build());

            try {
                if (publishOne(config, artifact, reference, credential)) {
                    pushed.add(artifact.getRelativeDirectory());
                }
            } catch (ShipyardException e) {
                failed.add(artifact.getName());
                events.publish(PipelineEvent.error(PipelineEventType.DEPLOYMENT_ERROR, artifact.getName(), artifact.getRelativeFile(), e));
                if (config.isFailFast()) {
                    log.error("Aborting deploy after failure of {} (fail-fast)", artifact.getName());
                    return new PublishOutcome(false, true, tags, pushed, failed);
                }
            }
        }

        return new PublishOutcome(failed.isEmpty(), false, tags, pushed, failed);
    }

    /**
     * @return true when the image was built and pushed, false when it already existed
     */
    private boolean publishOne(RunConfiguration config, Artifact artifact, ImageReference reference, RegistryCredential credential) {
        registryClient.checkAuth(credential);

        if (registryClient.probe(reference, credential) == ProbeResult.FOUND) {
            events.publish(PipelineEvent.builder()
                    .type(PipelineEventType.IMAGE_EXISTS)
                    .unit(artifact.getName())
                    .file(artifact.getRelativeFile())
                    .tag(reference.toString())
                    .build());
            return false;
        }

        log.debug("Image {} not found, building", reference);

        try (InputStream context = buildContext(config, artifact)) {
            registryClient.buildImage(context, reference, progress -> onBuildProgress(artifact, progress));
        } catch (IOException e) {
            throw new ImageBuildException(artifact.getName(), "Cannot create build context for " + reference + ": " + e.getMessage(), e);
        }

        registryClient.pushImage(reference, credential, progress -> onPushProgress(artifact, reference, progress));
        return true;
    }

    private void onBuildProgress(Artifact artifact, BuildProgress progress) {
        if (progress.stream() != null) {
            events.publish(PipelineEvent.builder()
                    .type(PipelineEventType.IMAGE_BUILD_OUTPUT)
                    .unit(artifact.getName())
                    .file(artifact.getRelativeFile())
                    .message(progress.stream())
                    .build());
        }
        if (progress.imageId() != null) {
            events.publish(PipelineEvent.builder()
                    .type(PipelineEventType.IMAGE_BUILD_COMPLETE)
                    .unit(artifact.getName())
                    .file(artifact.getRelativeFile())
                    .hash(progress.imageId())
                    .build());
        }
    }

    private void onPushProgress(Artifact artifact, ImageReference reference, PushProgress progress) {
        PushStatus.parse(progress.status()).ifPresent(status -> events.publish(PipelineEvent.builder()
                .type(status.isTerminal() ? PipelineEventType.IMAGE_PUSHED : PipelineEventType.IMAGE_PUSH_PROGRESS)
                .unit(artifact.getName())
                .file(artifact.getRelativeFile())
                .tag(reference.toString())
                .layer(progress.id())
                .pushStatus(status)
                .progress(status.isTerminal() ? null : coarseProgress(progress.current()))
                .build()));
    }

    /**
     * Two-state progress: 100 once the daemon reports any transferred bytes for the layer, 0 before.
     */
    static int coarseProgress(Long current) {
        return current != null && current > 0 ? 100 : 0;
    }

    InputStream buildContext(RunConfiguration config, Artifact artifact) throws IOException {
        String entry = config.getEntryFileName();
        String target = config.getAppDir() + "/" + entry;
        String dockerfile = String.join("\n",
                "FROM " + config.getBaseImage(),
                "",
                "ENV APP_NAME=\"" + artifact.getName() + "\"",
                "ENV APP_VERSION=\"" + artifact.getVersion() + "\"",
                "",
                "COPY " + entry + " " + target,
                "",
                "CMD [\"node\", \"" + target + "\"]",
                "");

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(buffer)) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            addEntry(tar, "Dockerfile", dockerfile.getBytes(StandardCharsets.UTF_8));
            addEntry(tar, entry, Files.readAllBytes(artifact.getFile()));
            tar.finish();
        }
        return new ByteArrayInputStream(buffer.toByteArray());
    }

    private static void addEntry(TarArchiveOutputStream tar, String name, byte[] content) throws IOException {
        TarArchiveEntry entry = new TarArchiveEntry(name);
        entry.setSize(content.length);
        tar.putArchiveEntry(entry);
        tar.write(content);
        tar.closeArchiveEntry();
    }
}
