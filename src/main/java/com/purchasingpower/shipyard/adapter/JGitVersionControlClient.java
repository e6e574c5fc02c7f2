package com.purchasingpower.shipyard.adapter;

import com.purchasingpower.shipyard.exception.DiffException;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectLoader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads commit history and blob contents with JGit. The working directory must be the repository root,
 * paths passed to {@link #show} are relative to it.
 */
@Slf4j
@Service
public class JGitVersionControlClient implements VersionControlClient {

    @Override
    public List<String> lastTwoCommits(Path repositoryDir) {
        try (Git git = Git.open(repositoryDir.toFile())) {
            ObjectId head = git.getRepository().resolve(Constants.HEAD);
            if (head == null) {
                log.debug("Repository at {} has no HEAD commit", repositoryDir);
                return List.of();
            }

            List<String> commits = new ArrayList<>();
            for (RevCommit commit : git.log().add(head).setMaxCount(2).call()) {
                commits.add(commit.getName());
            }
            return commits;

        } catch (IOException | GitAPIException e) {
            throw new DiffException(null, "Failed to read commit log in " + repositoryDir + ": " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] show(Path repositoryDir, String revision, String path) {
        try (Git git = Git.open(repositoryDir.toFile())) {
            Repository repository = git.getRepository();

            ObjectId commitId = repository.resolve(revision);
            if (commitId == null) {
                throw new DiffException(null, "Unknown revision " + revision);
            }

            try (RevWalk walk = new RevWalk(repository)) {
                RevCommit commit = walk.parseCommit(commitId);

                try (TreeWalk treeWalk = TreeWalk.forPath(repository, path, commit.getTree())) {
                    if (treeWalk == null) {
                        throw new DiffException(null,
                                "Path '" + path + "' does not exist in '" + abbreviate(revision) + "'");
                    }
                    ObjectLoader loader = repository.open(treeWalk.getObjectId(0));
                    return loader.getBytes();
                }
            }

        } catch (IOException e) {
            throw new DiffException(null, "Failed to read " + path + " at " + abbreviate(revision) + ": " + e.getMessage(), e);
        }
    }

    private static String abbreviate(String revision) {
        return revision != null && revision.length() > 8 ? revision.substring(0, 8) : revision;
    }
}
