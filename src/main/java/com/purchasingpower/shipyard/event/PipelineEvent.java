package com.purchasingpower.shipyard.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.shipyard.adapter.LintMessage;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One entry of the outbound event stream.
 *
 * Only {@code type} is always set; the remaining fields are populated according to the type:
 * <pre>
 * PipelineEvent event = PipelineEvent.builder()
 *     .type(PipelineEventType.DIFF_FILE)
 *     .unit("svc-a")
 *     .file("build/svc/a/lib.js")
 *     .changed(true)
 *     .build();
 * </pre>
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineEvent {

    PipelineEventType type;

    /**
     * Logical unit name ("svc-a").
     */
    String unit;

    /**
     * Path relative to the working directory.
     */
    String file;

    List<String> files;

    String message;

    List<String> errors;

    List<LintMessage> lintMessages;

    Boolean changed;

    String currentHash;

    String previousHash;

    /**
     * Fingerprint of the unit inputs.
     */
    String hash;

    /**
     * Content hash of the emitted artifact.
     */
    String version;

    String tag;

    String layer;

    /**
     * Push progress, either 0 or 100.
     */
    Integer progress;

    PushStatus pushStatus;

    Long durationMs;

    public static PipelineEvent of(PipelineEventType type, String unit, String file) {
        return PipelineEvent.builder().type(type).unit(unit).file(file).build();
    }

    public static PipelineEvent error(PipelineEventType type, String unit, String file, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return PipelineEvent.builder()
                .type(type)
                .unit(unit)
                .file(file)
                .errors(List.of(message))
                .build();
    }
}
