package org.rostilos.difflens.gitclient;

import org.rostilos.difflens.gitclient.model.DiffKind;

import java.util.List;

/**
 * Source of raw diff text and the repository facts needed around it.
 * All methods report backend failures as {@link GitClientException}.
 */
public interface DiffProvider {

    int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Raw unified diff of tracked files.
     *
     * @param kind         which changes to include
     * @param contextLines unchanged lines around each hunk; negative leaves git's default
     */
    String rawDiffText(DiffKind kind, int contextLines);

    /**
     * Paths reported by {@code git status}, without their status codes.
     */
    List<String> listChangedPaths();

    /**
     * Content of a file at HEAD, or from the working tree when HEAD does not have it.
     */
    String fileContent(String path);

    /**
     * Files git does not track and does not ignore.
     */
    List<String> listUntrackedFiles();

    /**
     * Content of a file as it currently is on disk.
     */
    String workingTreeContent(String path);
}
