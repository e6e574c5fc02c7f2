package com.purchasingpower.shipyard.change;

import com.purchasingpower.shipyard.adapter.VersionControlClient;
import com.purchasingpower.shipyard.event.PipelineEvent;
import com.purchasingpower.shipyard.event.PipelineEventPublisher;
import com.purchasingpower.shipyard.event.PipelineEventType;
import com.purchasingpower.shipyard.exception.DiffException;
import com.purchasingpower.shipyard.fingerprint.Fingerprinter;
import com.purchasingpower.shipyard.model.FileDiff;
import com.purchasingpower.shipyard.model.RevisionPair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;

/**
 * Compares a file's committed content between the two most recent commits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HistoryDiffer {

    private final VersionControlClient versionControl;
    private final Fingerprinter fingerprinter;
    private final PipelineEventPublisher events;

    /**
     * Resolves the revision pair every comparison of this run is made against.
     * A failed lookup is reported and yields an empty pair.
     */
    public RevisionPair capture(Path workingDir) {
        try {
            RevisionPair revisions = RevisionPair.of(versionControl.lastTwoCommits(workingDir));
            log.debug("Comparing history between {} and {}", revisions.previous(), revisions.head());
            return revisions;
        } catch (DiffException e) {
            events.publish(PipelineEvent.error(PipelineEventType.DIFF_ERROR, null, null, e));
            return RevisionPair.none();
        }
    }

    /**
     * @throws DiffException when there is no previous revision or either blob cannot be read
     */
    public FileDiff diff(Path workingDir, RevisionPair revisions, String path) {
        if (!revisions.isComplete()) {
            throw new DiffException(null, "No previous commit to compare " + path + " against");
        }

        byte[] current = versionControl.show(workingDir, revisions.head(), path);
        byte[] previous = versionControl.show(workingDir, revisions.previous(), path);

        String currentHash = fingerprinter.fullHash(current);
        String previousHash = fingerprinter.fullHash(previous);

        return new FileDiff(path, !Arrays.equals(current, previous), currentHash, previousHash);
    }
}
