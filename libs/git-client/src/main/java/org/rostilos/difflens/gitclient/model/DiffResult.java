package org.rostilos.difflens.gitclient.model;

import org.rostilos.difflens.diff.model.FileChange;

import java.util.List;
import java.util.Objects;

/**
 * Files of one diff together with the kind of diff that produced them.
 */
public record DiffResult(
        List<FileChange> files,
        DiffKind kind
) {
    public DiffResult {
        Objects.requireNonNull(kind, "kind must not be null");
        files = files == null ? List.of() : List.copyOf(files);
    }

    public int totalAdditions() {
        return files.stream().mapToInt(FileChange::additions).sum();
    }

    public int totalDeletions() {
        return files.stream().mapToInt(FileChange::deletions).sum();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
