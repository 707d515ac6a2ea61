package org.rostilos.difflens.gitclient;

import org.rostilos.difflens.gitclient.command.GitCommandRunner;
import org.rostilos.difflens.gitclient.model.DiffKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link DiffProvider} backed by the git command line.
 */
public class GitDiffProvider implements DiffProvider {

    private static final Logger log = LoggerFactory.getLogger(GitDiffProvider.class);

    private static final int STATUS_CODE_WIDTH = 3;
    private static final String RENAME_ARROW = " -> ";

    private final GitCommandRunner runner;
    private final WorkingTreeReader workingTree;

    public GitDiffProvider(GitCommandRunner runner, WorkingTreeReader workingTree) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.workingTree = Objects.requireNonNull(workingTree, "workingTree must not be null");
    }

    @Override
    public String rawDiffText(DiffKind kind, int contextLines) {
        List<String> arguments = new ArrayList<>(kind.getBaseArguments());
        arguments.add("--no-color");
        arguments.add("--no-ext-diff");
        if (contextLines >= 0) {
            arguments.add("-U" + contextLines);
        }
        return runner.run(arguments);
    }

    @Override
    public List<String> listChangedPaths() {
        String output = runner.run(List.of("status", "--porcelain"));
        List<String> paths = new ArrayList<>();
        for (String line : output.split("\n")) {
            // the status code occupies a fixed-width column and may start with a space
            String entry = stripTrailingCarriageReturn(line);
            if (entry.length() <= STATUS_CODE_WIDTH) {
                continue;
            }
            String path = entry.substring(STATUS_CODE_WIDTH).trim();
            int arrow = path.indexOf(RENAME_ARROW);
            if (arrow >= 0) {
                path = path.substring(arrow + RENAME_ARROW.length());
            }
            paths.add(path);
        }
        return paths;
    }

    @Override
    public String fileContent(String path) {
        try {
            return runner.run(List.of("show", "HEAD:" + path));
        } catch (GitClientException e) {
            log.debug("{} not found at HEAD, reading working tree: {}", path, e.getMessage());
            return workingTree.read(path);
        }
    }

    @Override
    public List<String> listUntrackedFiles() {
        String output = runner.run(List.of("ls-files", "--others", "--exclude-standard"));
        List<String> files = new ArrayList<>();
        for (String line : output.split("\n")) {
            String path = stripTrailingCarriageReturn(line).trim();
            if (!path.isEmpty()) {
                files.add(path);
            }
        }
        return files;
    }

    @Override
    public String workingTreeContent(String path) {
        return workingTree.read(path);
    }

    private static String stripTrailingCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
