package com.purchasingpower.shipyard.adapter;

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
 * Lints through the ESLint CLI, feeding content on stdin and reading the JSON formatter output.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EslintProcessLintEngine implements LintEngine {

    // eslint exits with 2 on configuration or crash errors, 1 when it found problems
    private static final int FATAL_EXIT_CODE = 2;

    private final ShipyardProperties props;
    private final CommandRunner commandRunner;
    private final ObjectMapper objectMapper;

    @Override
    public LintReport lint(Path lintConfig, String content, Path file) throws IOException {
        List<String> command = new ArrayList<>(ToolProperties.split(props.getTools().getEslint()));
        command.add("--config");
        command.add(lintConfig.toString());
        command.add("--format");
        command.add("json");
        command.add("--stdin");
        command.add("--stdin-filename");
        command.add(file.toString());

        Path workingDir = lintConfig.toAbsolutePath().getParent();
        CommandResult result = commandRunner.run(command, workingDir, content);

        if (result.exitCode() >= FATAL_EXIT_CODE || result.stdout().isBlank()) {
            throw new IOException("eslint failed on " + file + " (exit " + result.exitCode() + "): " + result.stderr().trim());
        }

        return parse(file, result.stdout());
    }

    LintReport parse(Path file, String json) throws IOException {
        JsonNode results = objectMapper.readTree(json);
        List<LintMessage> messages = new ArrayList<>();
        for (JsonNode result : results) {
            for (JsonNode message : result.path("messages")) {
                messages.add(objectMapper.treeToValue(message, LintMessage.class));
            }
        }
        log.trace("eslint reported {} messages for {}", messages.size(), file);
        return new LintReport(file.toString(), messages);
    }
}
