package org.rostilos.difflens.diff.parser;

import org.rostilos.difflens.diff.model.FileChange;
import org.rostilos.difflens.diff.model.FileStatus;
import org.rostilos.difflens.diff.model.Hunk;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state collected while scanning one {@code diff --git} section.
 */
final class FileSectionBuilder {

    private String oldPath = "";
    private String path = "";
    private FileStatus status;
    private boolean binary;
    private final List<Hunk> hunks = new ArrayList<>();

    void paths(String oldPath, String path) {
        this.oldPath = oldPath;
        this.path = path;
    }

    void status(FileStatus status) {
        this.status = status;
    }

    void renamedFrom(String oldPath) {
        this.status = FileStatus.RENAMED;
        this.oldPath = oldPath;
    }

    void binary() {
        this.binary = true;
    }

    void addHunk(Hunk hunk) {
        hunks.add(hunk);
    }

    boolean isBinary() {
        return binary;
    }

    int hunkCount() {
        return hunks.size();
    }

    String path() {
        return path;
    }

    FileChange build() {
        FileStatus resolved = status == null ? FileStatus.MODIFIED : status;
        List<Hunk> resolvedHunks = binary ? List.of() : hunks;
        return FileChange.of(oldPath, path, resolved, binary, resolvedHunks);
    }
}
