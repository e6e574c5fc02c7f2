package com.purchasingpower.shipyard.adapter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Static analysis over a single source file.
 */
public interface LintEngine {

    /**
     * @param lintConfig lint configuration file
     * @param content    file content to lint
     * @param file       path used for reporting and rule selection
     */
    LintReport lint(Path lintConfig, String content, Path file) throws IOException;
}
