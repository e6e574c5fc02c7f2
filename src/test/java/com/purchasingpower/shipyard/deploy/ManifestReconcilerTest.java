package com.purchasingpower.shipyard.deploy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.shipyard.adapter.JGitVersionControlClient;
import com.purchasingpower.shipyard.change.HistoryDiffer;
import com.purchasingpower.shipyard.configuration.RunConfiguration;
import com.purchasingpower.shipyard.event.PipelineEvent;
import com.purchasingpower.shipyard.event.PipelineEventPublisher;
import com.purchasingpower.shipyard.event.PipelineEventType;
import com.purchasingpower.shipyard.fingerprint.Fingerprinter;
import com.purchasingpower.shipyard.model.Artifact;
import com.purchasingpower.shipyard.model.ImageReference;
import com.purchasingpower.shipyard.model.PackageDescriptor;
import com.purchasingpower.shipyard.model.RevisionPair;
import com.purchasingpower.shipyard.support.FakeApplyTransport;
import com.purchasingpower.shipyard.support.GitRepoFixture;
import com.purchasingpower.shipyard.support.RecordingEventListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Manifest Reconciler Tests")
class ManifestReconcilerTest {

    @TempDir
    Path root;

    private GitRepoFixture repo;
    private RecordingEventListener events;
    private FakeApplyTransport transport;
    private HistoryDiffer historyDiffer;
    private ManifestReconciler reconciler;

    private List<Artifact> artifacts;
    private Map<String, ImageReference> tags;

    @BeforeEach
    void setUp() throws Exception {
        repo = GitRepoFixture.init(root);
        events = new RecordingEventListener();
        transport = new FakeApplyTransport();
        PipelineEventPublisher publisher = PipelineEventPublisher.of(events);
        historyDiffer = new HistoryDiffer(new JGitVersionControlClient(), new Fingerprinter(new ObjectMapper()), publisher);
        reconciler = new ManifestReconciler(new TextualManifestRewriter(), historyDiffer, transport, publisher);

        repo.write("deploy/config.yaml", "kind: ConfigMap\n");
        repo.write("deploy/svc-a.yaml", "kind: Deployment\nimage: dist/svc/a\n");
        repo.write("deploy/svc-b.yaml", "---\nkind: Deployment\nimage: dist/svc/b\n");
        repo.commit("manifests");
        repo.write("README.md", "docs\n");
        repo.commit("docs");

        artifacts = List.of(artifact("svc-a", "dist/svc/a", "aaaaaaaaaa"), artifact("svc-b", "dist/svc/b", "bbbbbbbbbb"));
        tags = new LinkedHashMap<>();
        for (Artifact artifact : artifacts) {
            tags.put(artifact.getRelativeDirectory(), ImageReference.of(null, artifact.getName(), artifact.getVersion()));
        }
    }

    @AfterEach
    void tearDown() {
        repo.close();
    }

    @Test
    @DisplayName("Should apply nothing when no image was pushed and no manifest changed")
    void testReconcile_ShouldSkipWhenClean() {
        ReconcileOutcome outcome = reconciler.reconcile(config().build(), artifacts, tags, Set.of(), List.of(), revisions());

        assertTrue(outcome.success());
        assertFalse(outcome.applied());
        assertEquals(List.of("svc-a", "svc-b"), outcome.skipped());
        assertTrue(transport.applied().isEmpty());
        assertEquals(3, events.ofType(PipelineEventType.MANIFEST_DIFF).size());
        assertEquals(2, events.ofType(PipelineEventType.DEPLOYMENT_SKIP).size());
    }

    @Test
    @DisplayName("Should apply the full rewritten manifest set when an image was pushed")
    void testReconcile_ShouldApplyAllFragmentsAfterPush() {
        ReconcileOutcome outcome = reconciler.reconcile(config().build(), artifacts, tags, Set.of("dist/svc/a"), List.of(), revisions());

        assertTrue(outcome.success());
        assertTrue(outcome.applied());
        assertEquals(List.of("svc-a"), outcome.deployed());
        assertEquals(List.of("svc-b"), outcome.skipped());
        assertEquals(List.of("deploy/svc-a.yaml"), outcome.dirtyFragments());

        assertEquals(List.of(
                "\n---\nkind: ConfigMap\n"
                        + "\n---\nkind: Deployment\nimage: docker.io/svc-a:aaaaaaaaaa\n"
                        + "\n---\nkind: Deployment\nimage: docker.io/svc-b:bbbbbbbbbb\n"), transport.applied());

        PipelineEvent dependencies = events.ofType(PipelineEventType.DEPLOYMENT_DEPENDENCIES).get(0);
        assertEquals("svc-a", dependencies.getUnit());
        assertEquals(List.of("deploy/svc-a.yaml"), dependencies.getFiles());

        assertEquals(1, events.ofType(PipelineEventType.MANIFEST_RENDERED).size());
        assertEquals(List.of("deployment.apps/svc-a configured", "service/svc-a unchanged"),
                events.ofType(PipelineEventType.APPLY_OUTPUT).stream().map(PipelineEvent::getMessage).toList());
    }

    @Test
    @DisplayName("Should apply when a manifest changed in the last commit")
    void testReconcile_ShouldApplyOnManifestChange() throws Exception {
        repo.write("deploy/config.yaml", "kind: ConfigMap\ndata: {}\n");
        repo.commit("config");

        ReconcileOutcome outcome = reconciler.reconcile(config().build(), artifacts, tags, Set.of(), List.of(), revisions());

        assertTrue(outcome.applied());
        assertEquals(List.of("deploy/config.yaml"), outcome.dirtyFragments());
        assertEquals(List.of("svc-a", "svc-b"), outcome.skipped());
        assertEquals(1, transport.applied().size());
    }

    @Test
    @DisplayName("Should treat a manifest without history as dirty")
    void testReconcile_ShouldApplyOnNewManifest() throws Exception {
        repo.write("deploy/svc-c.yaml", "kind: Service\n");
        repo.commit("new service");

        ReconcileOutcome outcome = reconciler.reconcile(config().build(), artifacts, tags, Set.of(), List.of(), revisions());

        assertTrue(outcome.applied());
        assertEquals(List.of("deploy/svc-c.yaml"), outcome.dirtyFragments());
        assertEquals("deploy/svc-c.yaml", events.ofType(PipelineEventType.DIFF_ERROR).get(0).getFile());
    }

    @Test
    @DisplayName("Should fail when the cluster reports errors")
    void testReconcile_ShouldFailOnApplyError() {
        transport.failWith("error: unable to recognize \"manifest.yaml\"\n");

        ReconcileOutcome outcome = reconciler.reconcile(config().build(), artifacts, tags, Set.of("dist/svc/b"), List.of(), revisions());

        assertFalse(outcome.success());
        assertFalse(outcome.applied());
        List<PipelineEvent> errors = events.ofType(PipelineEventType.DEPLOYMENT_ERROR);
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).getErrors().get(0).contains("unable to recognize"));
        assertTrue(events.ofType(PipelineEventType.APPLY_OUTPUT).isEmpty());
    }

    @Test
    @DisplayName("Should mark everything dirty when forced")
    void testReconcile_ShouldApplyEverythingWhenForced() {
        ReconcileOutcome outcome = reconciler.reconcile(config().force(true).build(), artifacts, tags, Set.of(), List.of(), revisions());

        assertTrue(outcome.applied());
        assertEquals(List.of("svc-a", "svc-b"), outcome.deployed());
        assertEquals(Set.of("deploy/config.yaml", "deploy/svc-a.yaml", "deploy/svc-b.yaml"), Set.copyOf(outcome.dirtyFragments()));
        assertTrue(events.ofType(PipelineEventType.MANIFEST_DIFF).isEmpty());
    }

    @Test
    @DisplayName("Should withhold manifests that reference an artifact whose publish failed")
    void testReconcile_ShouldWithholdFragmentsOfFailedArtifacts() {
        // Given: svc-a was pushed, svc-b failed to publish
        // When
        ReconcileOutcome outcome = reconciler.reconcile(config().build(), artifacts, tags,
                Set.of("dist/svc/a"), List.of("svc-b"), revisions());

        // Then
        assertTrue(outcome.applied());
        assertEquals(List.of("svc-a"), outcome.deployed());
        assertTrue(outcome.skipped().isEmpty());
        assertFalse(outcome.dirtyFragments().contains("deploy/svc-b.yaml"));
        assertEquals(List.of(
                "\n---\nkind: ConfigMap\n"
                        + "\n---\nkind: Deployment\nimage: docker.io/svc-a:aaaaaaaaaa\n"), transport.applied());
        assertTrue(events.ofType(PipelineEventType.DEPLOYMENT_SKIP).isEmpty());
        assertEquals(List.of("svc-a"),
                events.ofType(PipelineEventType.DEPLOYMENT_READY).stream().map(PipelineEvent::getUnit).toList());
    }

    @Test
    @DisplayName("Should not report a failed artifact as skipped when nothing is dirty")
    void testReconcile_ShouldLeaveFailedArtifactOutOfSkipped() {
        ReconcileOutcome outcome = reconciler.reconcile(config().build(), artifacts, tags, Set.of(), List.of("svc-b"), revisions());

        assertFalse(outcome.applied());
        assertEquals(List.of("svc-a"), outcome.skipped());
        assertTrue(transport.applied().isEmpty());
        assertEquals(2, events.ofType(PipelineEventType.MANIFEST_DIFF).size());
    }

    @Test
    @DisplayName("Should collapse runs of empty documents")
    void testCollapseEmptyDocuments() {
        assertEquals("---\nkind: A\n", ManifestReconciler.collapseEmptyDocuments("---\n---\n---\nkind: A\n"));
        assertEquals("---\r\nkind: A\r\n", ManifestReconciler.collapseEmptyDocuments("---\r\n---\r\nkind: A\r\n"));
        assertEquals("kind: A\n---\nkind: B\n", ManifestReconciler.collapseEmptyDocuments("kind: A\n---\nkind: B\n"));
    }

    private RevisionPair revisions() {
        return historyDiffer.capture(root);
    }

    private RunConfiguration.RunConfigurationBuilder config() {
        return RunConfiguration.builder().workingDir(root);
    }

    private Artifact artifact(String name, String relativeDirectory, String version) {
        return Artifact.builder()
                .file(root.resolve(relativeDirectory).resolve("main.js"))
                .relativeFile(relativeDirectory + "/main.js")
                .directory(root.resolve(relativeDirectory))
                .relativeDirectory(relativeDirectory)
                .descriptor(PackageDescriptor.builder().name(name).version(version).build())
                .build();
    }
}
