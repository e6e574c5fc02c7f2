package com.purchasingpower.shipyard.event;

import com.purchasingpower.shipyard.adapter.LintMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders the event stream as log lines.
 */
@Slf4j
@Component
public class LoggingEventListener implements PipelineEventListener {

    @Override
    public void onEvent(PipelineEvent event) {
        switch (event.getType()) {
            case BUILDS_DISCOVERED -> log.info("Found {} build targets", size(event.getFiles()));
            case BUILD_DEPENDENCIES -> log.debug("Found {} dependencies for file {}", size(event.getFiles()), event.getFile());
            case LINT_FILE_ERROR -> {
                for (LintMessage message : event.getLintMessages()) {
                    log.error("Lint error on file {} at line {}:{}. error={}",
                            event.getFile(), message.line(), message.column(), message.message());
                }
            }
            case LINT_FILE -> log.debug("File {} linted with no errors", event.getFile());
            case LINT_ERROR -> log.error("Linter finished with {} errors for {}", size(event.getErrors()), event.getUnit());
            case LINT_PASSED -> log.debug("Linter for {} finished on {} dependencies", event.getFile(), size(event.getFiles()));
            case DIFF_FILE, MANIFEST_DIFF -> log.debug("Diff computed on file {}. changed={} currentHash={} previousHash={}",
                    event.getFile(), event.getChanged(), event.getCurrentHash(), event.getPreviousHash());
            case DIFF_ERROR -> errors(event).forEach(error ->
                    log.warn("Diff error on file {}. error={}", event.getFile(), error));
            case FINGERPRINT_ERROR -> errors(event).forEach(error ->
                    log.warn("Unreadable fingerprint {} for {}. error={}", event.getFile(), event.getUnit(), error));
            case BUILD_SKIP -> log.info("Build skipped for {}", event.getFile());
            case BUILD_READY -> log.info("Build for {} ready", event.getFile());
            case BUILD_ERROR -> errors(event).forEach(error ->
                    log.error("Build error on file {}. error={}", event.getFile(), error));
            case BUILD_COMPLETE -> log.info("Build for {} completed in {}ms. hash={} deps={}",
                    event.getFile(), event.getDurationMs(), event.getVersion(), event.getHash());
            case BUILD_STATS, DEPLOYMENT_STATS -> log.info(event.getMessage());
            case DEPLOYMENTS_DISCOVERED -> log.info("Found {} deployment targets", size(event.getFiles()));
            case IMAGE_TAG -> log.debug("Got image tag for {} image build. tag={}", event.getFile(), event.getTag());
            case IMAGE_EXISTS -> log.info("Found existing image for {}. tag={}", event.getFile(), event.getTag());
            case IMAGE_BUILD_OUTPUT -> {
                String line = event.getMessage() == null ? "" : event.getMessage().trim();
                if (!line.isEmpty()) {
                    log.debug("Building image for {}: {}", event.getFile(), line);
                }
            }
            case IMAGE_BUILD_COMPLETE -> log.debug("Completed image build for {}. hash={}", event.getFile(), event.getHash());
            case IMAGE_PUSH_PROGRESS -> log.debug("Pushing image layer for {}. tag={} layer={} progress={}",
                    event.getFile(), event.getTag(), event.getLayer(), event.getProgress());
            case IMAGE_PUSHED -> log.debug("Completed image layer push for {}. layer={} status={}",
                    event.getFile(), event.getLayer(), event.getPushStatus());
            case DEPLOYMENT_ERROR -> errors(event).forEach(error -> {
                if (event.getFile() != null) {
                    log.error("Deployment error on file {}. error={}", event.getFile(), error);
                } else {
                    log.error("Deployment error. error={}", error);
                }
            });
            case DEPLOYMENT_DEPENDENCIES -> log.debug("Found {} manifest dependencies for file {}", size(event.getFiles()), event.getFile());
            case DEPLOYMENT_READY -> log.info("Deployment for {} ready", event.getFile());
            case DEPLOYMENT_SKIP -> log.info("Deployment skipped for {}", event.getFile());
            case MANIFEST_RENDERED -> log.info("Applying kube manifest:\n{}", event.getMessage());
            case APPLY_OUTPUT -> log.info(event.getMessage());
            default -> log.trace("Unhandled event {}", event);
        }
    }

    private static int size(List<?> values) {
        return values == null ? 0 : values.size();
    }

    private static List<String> errors(PipelineEvent event) {
        return event.getErrors() == null ? List.of() : event.getErrors();
    }
}
