package com.purchasingpower.shipyard.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.Arrays;
import java.util.List;

/**
 * Command lines of the external tools, split on whitespace before execution.
 */
@Data
public class ToolProperties {

    @NotBlank
    private String eslint = "npx eslint";

    @NotBlank
    private String webpack = "npx webpack";

    @NotBlank
    private String kubectl = "kubectl";

    public static List<String> split(String command) {
        return Arrays.stream(command.trim().split("\\s+")).toList();
    }
}
