package com.purchasingpower.shipyard.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Descriptor written next to every built artifact as {@code package.json}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PackageDescriptor {

    public static final String FILE_NAME = "package.json";

    private String name;

    /**
     * Content hash of the artifact bytes.
     */
    private String version;

    /**
     * Fingerprint of the inputs the artifact was built from.
     */
    private String deps;

    /**
     * HEAD commit at build time, null when built outside a repository.
     */
    private String revision;
}
