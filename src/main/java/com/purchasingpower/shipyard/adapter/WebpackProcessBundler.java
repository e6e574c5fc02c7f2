package com.purchasingpower.shipyard.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.shipyard.configuration.ShipyardProperties;
import com.purchasingpower.shipyard.configuration.ToolProperties;
import com.purchasingpower.shipyard.util.CommandRunner;
import com.purchasingpower.shipyard.util.CommandRunner.CommandResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Bundles with the webpack CLI. The base config file is merged with the per-unit entry and output
 * through command line flags, and the JSON stats are parsed for errors.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebpackProcessBundler implements Bundler {

    private final ShipyardProperties props;
    private final CommandRunner commandRunner;
    private final ObjectMapper objectMapper;

    @Override
    public BundleReport bundle(BundleRequest request) throws IOException {
        List<String> command = new ArrayList<>(ToolProperties.split(props.getTools().getWebpack()));
        command.add("--config");
        command.add(request.configFile().toString());
        command.add("--entry");
        command.add(request.entryFile().toString());
        command.add("--output-path");
        command.add(request.outputDir().toString());
        command.add("--output-filename");
        command.add(request.outputFileName());
        command.add("--json");

        Path workingDir = request.configFile().toAbsolutePath().getParent();
        CommandResult result = commandRunner.run(command, workingDir);

        List<String> errors = parseErrors(result.stdout());
        if (errors.isEmpty() && !result.isSuccess()) {
            errors = List.of("webpack exited with " + result.exitCode() + ": " + result.stderr().trim());
        }

        return BundleReport.builder()
                .errors(errors)
                .durationMs(result.durationMs())
                .build();
    }

    List<String> parseErrors(String statsJson) {
        if (statsJson == null || statsJson.isBlank()) {
            return List.of();
        }
        try {
            JsonNode stats = objectMapper.readTree(statsJson);
            List<String> errors = new ArrayList<>();
            for (JsonNode error : stats.path("errors")) {
                errors.add(error.isTextual() ? error.asText() : error.path("message").asText(error.toString()));
            }
            return errors;
        } catch (JsonProcessingException e) {
            log.warn("Unreadable webpack stats output: {}", e.getOriginalMessage());
            return List.of("Unreadable webpack stats output: " + e.getOriginalMessage());
        }
    }
}
