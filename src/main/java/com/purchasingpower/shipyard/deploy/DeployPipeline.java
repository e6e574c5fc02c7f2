package com.purchasingpower.shipyard.deploy;

import com.purchasingpower.shipyard.change.HistoryDiffer;
import com.purchasingpower.shipyard.configuration.RunConfiguration;
import com.purchasingpower.shipyard.event.PipelineEvent;
import com.purchasingpower.shipyard.event.PipelineEventPublisher;
import com.purchasingpower.shipyard.event.PipelineEventType;
import com.purchasingpower.shipyard.model.Artifact;
import com.purchasingpower.shipyard.model.RevisionPair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Deploy phase: publish images for built artifacts, then reconcile cluster manifests.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeployPipeline {

    private final ArtifactScanner artifactScanner;
    private final ImagePublisher imagePublisher;
    private final ManifestReconciler manifestReconciler;
    private final HistoryDiffer historyDiffer;
    private final PipelineEventPublisher events;

    /**
     * @throws com.purchasingpower.shipyard.exception.InvalidAuthException when artifacts exist but the target
     *         registry has no credential
     */
    public DeployRunResult run(RunConfiguration config) {
        log.info("Starting deployment in {}", config.getWorkingDir());

        List<Artifact> artifacts = artifactScanner.scan(config);
        List<String> names = artifacts.stream().map(Artifact::getName).toList();

        events.publish(PipelineEvent.builder()
                .type(PipelineEventType.DEPLOYMENTS_DISCOVERED)
                .files(artifacts.stream().map(Artifact::getRelativeFile).toList())
                .build());

        RegistryCredentials credentials = RegistryCredentials.parse(config.getRegistryAuth());
        RevisionPair revisions = historyDiffer.capture(config.getWorkingDir());

        PublishOutcome published = imagePublisher.publish(config, artifacts, credentials);
        if (published.aborted()) {
            return DeployRunResult.builder()
                    .success(false)
                    .artifacts(names)
                    .pushed(pushedNames(artifacts, published))
                    .deployed(List.of())
                    .skipped(List.of())
                    .failed(published.failed())
                    .applied(false)
                    .build();
        }

        ReconcileOutcome reconciled = manifestReconciler.reconcile(
                config, artifacts, published.tags(), published.pushed(), published.failed(), revisions);

        DeployRunResult result = DeployRunResult.builder()
                .success(published.success() && reconciled.success())
                .artifacts(names)
                .pushed(pushedNames(artifacts, published))
                .deployed(reconciled.deployed())
                .skipped(reconciled.skipped())
                .failed(published.failed())
                .applied(reconciled.applied())
                .build();

        events.publish(PipelineEvent.builder()
                .type(PipelineEventType.DEPLOYMENT_STATS)
                .files(names)
                .message(result.summary())
                .build());
        return result;
    }

    private static List<String> pushedNames(List<Artifact> artifacts, PublishOutcome published) {
        return artifacts.stream()
                .filter(artifact -> published.pushed().contains(artifact.getRelativeDirectory()))
                .map(Artifact::getName)
                .toList();
    }
}
