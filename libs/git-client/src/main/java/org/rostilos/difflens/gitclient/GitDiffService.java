package org.rostilos.difflens.gitclient;

import org.rostilos.difflens.diff.model.FileChange;
import org.rostilos.difflens.diff.parser.UnifiedDiffParser;
import org.rostilos.difflens.gitclient.model.DiffKind;
import org.rostilos.difflens.gitclient.model.DiffResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Collects the structured diff of a local repository.
 * <p>
 * Tracked changes come from {@code git diff} and go through {@link UnifiedDiffParser};
 * untracked files are appended as all-added changes for the kinds that cover the
 * working tree. A failure of the tracked diff fails the whole call, while a single
 * untracked file that cannot be read is only left out.
 */
public class GitDiffService {

    private static final Logger log = LoggerFactory.getLogger(GitDiffService.class);

    /**
     * Context size large enough for git to show every unchanged line of a file.
     */
    public static final int FULL_CONTEXT_LINES = 999999;

    private final DiffProvider diffProvider;
    private final UnifiedDiffParser parser;
    private final UntrackedFileDiffFactory untrackedFileDiffFactory;
    private final int defaultContextLines;
    private final boolean includeUntracked;

    public GitDiffService(DiffProvider diffProvider, UnifiedDiffParser parser) {
        this(diffProvider, parser, new UntrackedFileDiffFactory(), DiffProvider.DEFAULT_CONTEXT_LINES, true);
    }

    public GitDiffService(
            DiffProvider diffProvider,
            UnifiedDiffParser parser,
            UntrackedFileDiffFactory untrackedFileDiffFactory,
            int defaultContextLines,
            boolean includeUntracked
    ) {
        this.diffProvider = diffProvider;
        this.parser = parser;
        this.untrackedFileDiffFactory = untrackedFileDiffFactory;
        this.defaultContextLines = defaultContextLines;
        this.includeUntracked = includeUntracked;
    }

    public DiffResult getDiff(DiffKind kind) {
        return getDiff(kind, defaultContextLines);
    }

    public DiffResult getDiff(DiffKind kind, int contextLines) {
        String rawDiff;
        try {
            rawDiff = diffProvider.rawDiffText(kind, contextLines);
        } catch (GitClientException e) {
            throw new GitClientException("Failed to get diff: " + e.getMessage(), e);
        }

        List<FileChange> files = new ArrayList<>(parser.parse(rawDiff));
        if (includeUntracked && kind.includesUntracked()) {
            files.addAll(collectUntracked());
        }

        log.debug("{} diff: {} file(s)", kind, files.size());
        return new DiffResult(files, kind);
    }

    public List<String> getStatus() {
        return diffProvider.listChangedPaths();
    }

    public String getFileContent(String path) {
        return diffProvider.fileContent(path);
    }

    /**
     * Change of a single file, or empty when the file is not part of the diff.
     * An untracked file is reported as all-added whatever the kind, staged included.
     */
    public Optional<FileChange> getFileDiff(String path, DiffKind kind, int contextLines) {
        if (includeUntracked && untrackedFiles().contains(path)) {
            return Optional.of(untrackedFileDiffFactory.synthesize(path, diffProvider.workingTreeContent(path)));
        }
        return getDiff(kind, contextLines).files().stream()
                .filter(file -> path.equals(file.path()))
                .findFirst();
    }

    public Optional<FileChange> getFileDiff(String path, DiffKind kind) {
        return getFileDiff(path, kind, defaultContextLines);
    }

    public Optional<FileChange> getFileDiffWithFullContext(String path, DiffKind kind) {
        return getFileDiff(path, kind, FULL_CONTEXT_LINES);
    }

    private List<FileChange> collectUntracked() {
        List<FileChange> changes = new ArrayList<>();
        for (String path : untrackedFiles()) {
            try {
                changes.add(untrackedFileDiffFactory.synthesize(path, diffProvider.workingTreeContent(path)));
            } catch (GitClientException e) {
                log.warn("Skipping untracked file {}: {}", path, e.getMessage());
            }
        }
        return changes;
    }

    private List<String> untrackedFiles() {
        try {
            return diffProvider.listUntrackedFiles();
        } catch (GitClientException e) {
            log.warn("Could not list untracked files: {}", e.getMessage());
            return Collections.emptyList();
        }
    }
}
