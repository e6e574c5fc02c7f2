package com.purchasingpower.shipyard.adapter;

import com.purchasingpower.shipyard.exception.DiffException;

import java.nio.file.Path;
import java.util.List;

public interface VersionControlClient {

    /**
     * Commit ids of the two most recent commits reachable from HEAD, in log order, newest first.
     * Fewer than two entries means there is no history to diff against.
     *
     * @throws DiffException when the repository cannot be read
     */
    List<String> lastTwoCommits(Path repositoryDir);

    /**
     * Blob content of {@code path} at {@code revision}.
     *
     * @throws DiffException when the revision or the path does not exist
     */
    byte[] show(Path repositoryDir, String revision, String path);
}
