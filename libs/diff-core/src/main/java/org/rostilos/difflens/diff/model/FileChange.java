package org.rostilos.difflens.diff.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * Parsed change of a single file.
 * <p>
 * {@code additions} and {@code deletions} always equal the number of added and deleted
 * lines across {@code hunks}; the canonical constructor rejects anything else. Use
 * {@link #of(String, String, FileStatus, boolean, List)} to have them tallied.
 *
 * @param oldPath    path before the change; differs from {@code path} only for renames
 * @param path       path after the change
 * @param status     kind of change
 * @param binary     true when git reported a binary change instead of textual hunks
 * @param additions  number of added lines
 * @param deletions  number of deleted lines
 * @param hunks      change regions in diff order, empty for binary files
 */
public record FileChange(
        String oldPath,
        String path,
        FileStatus status,
        boolean binary,
        int additions,
        int deletions,
        List<Hunk> hunks
) {
    public FileChange {
        Objects.requireNonNull(status, "status must not be null");
        hunks = hunks == null ? List.of() : List.copyOf(hunks);
        if (binary && !hunks.isEmpty()) {
            throw new IllegalArgumentException("Binary change of " + path + " cannot carry hunks");
        }
        int countedAdditions = tally(hunks, LineType.ADDED);
        int countedDeletions = tally(hunks, LineType.DELETED);
        if (additions != countedAdditions || deletions != countedDeletions) {
            throw new IllegalArgumentException(String.format(
                    "Line counts of %s do not match its hunks: +%d/-%d declared, +%d/-%d counted",
                    path, additions, deletions, countedAdditions, countedDeletions));
        }
    }

    public static FileChange of(String oldPath, String path, FileStatus status, boolean binary, List<Hunk> hunks) {
        List<Hunk> safeHunks = hunks == null ? List.of() : hunks;
        return new FileChange(oldPath, path, status, binary,
                tally(safeHunks, LineType.ADDED), tally(safeHunks, LineType.DELETED), safeHunks);
    }

    @JsonIgnore
    public boolean isRenamed() {
        return status == FileStatus.RENAMED;
    }

    /**
     * Total number of body lines across all hunks.
     */
    public int lineCount() {
        return hunks.stream().mapToInt(hunk -> hunk.lines().size()).sum();
    }

    private static int tally(List<Hunk> hunks, LineType type) {
        long total = 0;
        for (Hunk hunk : hunks) {
            total += hunk.count(type);
        }
        return Math.toIntExact(total);
    }
}
