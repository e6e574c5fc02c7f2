package com.purchasingpower.shipyard.support;

import com.purchasingpower.shipyard.adapter.LintEngine;
import com.purchasingpower.shipyard.adapter.LintMessage;
import com.purchasingpower.shipyard.adapter.LintReport;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reports one error for every line containing {@value #MARKER}.
 */
public class FakeLintEngine implements LintEngine {

    public static final String MARKER = "LINT_ERROR";

    private final List<Path> linted = new ArrayList<>();

    @Override
    public LintReport lint(Path lintConfig, String content, Path file) {
        linted.add(file);
        List<LintMessage> messages = new ArrayList<>();
        String[] lines = content.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            int column = lines[i].indexOf(MARKER);
            if (column >= 0) {
                messages.add(new LintMessage("no-marker", LintMessage.SEVERITY_ERROR, "Unexpected marker", i + 1, column + 1));
            }
        }
        return new LintReport(file.toString(), messages);
    }

    public List<Path> linted() {
        return List.copyOf(linted);
    }
}
