package com.purchasingpower.shipyard.change;

import com.purchasingpower.shipyard.event.PipelineEvent;
import com.purchasingpower.shipyard.event.PipelineEventPublisher;
import com.purchasingpower.shipyard.event.PipelineEventType;
import com.purchasingpower.shipyard.exception.DiffException;
import com.purchasingpower.shipyard.exception.FingerprintReadException;
import com.purchasingpower.shipyard.fingerprint.Fingerprinter;
import com.purchasingpower.shipyard.model.FileDiff;
import com.purchasingpower.shipyard.model.RevisionPair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a unit's inputs changed since its last successful run.
 *
 * <p>Two signals are OR-ed, so either one alone forces processing:
 * <ol>
 *   <li>history: any input whose content differs between the two most recent commits, or whose blobs cannot be
 *   read, counts as changed. Missing history counts as changed. The signal is dropped when the last
 *   build already ran at HEAD, because that build saw the same commit.</li>
 *   <li>fingerprint: the persisted sidecar must equal the fingerprint of the current inputs.</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeOracle {

    private final Fingerprinter fingerprinter;
    private final HistoryDiffer historyDiffer;
    private final PipelineEventPublisher events;

    public ChangeDecision decide(ChangeQuery query) {
        List<Path> files = query.getInputs().stream()
                .map(input -> query.getWorkingDir().resolve(input))
                .toList();
        String currentFingerprint = fingerprinter.fingerprint(files);

        if (query.isForce()) {
            return new ChangeDecision(true, currentFingerprint, List.of("forced"));
        }

        List<String> reasons = new ArrayList<>();
        boolean historyChanged = historyChanged(query, reasons);

        Optional<String> persisted;
        try {
            persisted = readPersisted(query.getUnit(), query.getFingerprintFile());
        } catch (FingerprintReadException e) {
            if (!historyChanged) {
                throw e;
            }
            events.publish(PipelineEvent.error(PipelineEventType.FINGERPRINT_ERROR, query.getUnit(),
                    query.getFingerprintFile().toString(), e));
            reasons.add("persisted fingerprint unreadable");
            return new ChangeDecision(true, currentFingerprint, reasons);
        }

        boolean fingerprintChanged = true;
        if (persisted.isEmpty()) {
            reasons.add("no persisted fingerprint");
        } else if (!persisted.get().equals(currentFingerprint)) {
            reasons.add("fingerprint " + persisted.get() + " -> " + currentFingerprint);
        } else {
            fingerprintChanged = false;
        }

        boolean needsProcessing = historyChanged || fingerprintChanged;
        log.debug("Change decision for {}: needsProcessing={} reasons={}", query.getUnit(), needsProcessing, reasons);
        return new ChangeDecision(needsProcessing, currentFingerprint, reasons);
    }

    private boolean historyChanged(ChangeQuery query, List<String> reasons) {
        RevisionPair revisions = query.getRevisions() == null ? RevisionPair.none() : query.getRevisions();

        if (query.getLastBuiltRevision() != null && query.getLastBuiltRevision().equals(revisions.head())) {
            return false;
        }

        if (!revisions.isComplete()) {
            reasons.add("no previous commit");
            return true;
        }

        boolean changed = false;
        for (String input : query.getInputs()) {
            try {
                FileDiff diff = historyDiffer.diff(query.getWorkingDir(), revisions, input);
                events.publish(PipelineEvent.builder()
                        .type(PipelineEventType.DIFF_FILE)
                        .unit(query.getUnit())
                        .file(input)
                        .changed(diff.changed())
                        .currentHash(diff.currentHash())
                        .previousHash(diff.previousHash())
                        .build());
                if (diff.changed()) {
                    reasons.add("changed in history: " + input);
                    changed = true;
                }
            } catch (DiffException e) {
                events.publish(PipelineEvent.error(PipelineEventType.DIFF_ERROR, query.getUnit(), input, e));
                reasons.add("history unavailable: " + input);
                changed = true;
            }
        }
        return changed;
    }

    private Optional<String> readPersisted(String unit, Path fingerprintFile) {
        try {
            return Optional.of(Files.readString(fingerprintFile, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new FingerprintReadException(unit, "Cannot read persisted fingerprint " + fingerprintFile + ": " + e, e);
        }
    }
}
