package org.rostilos.difflens.diff.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A contiguous change region of one file.
 *
 * @param oldStart 1-based first line of the region in the old file (0 for a file that did not exist)
 * @param oldLines number of old-file lines the region covers
 * @param newStart 1-based first line of the region in the new file
 * @param newLines number of new-file lines the region covers
 * @param header   the {@code @@ ... @@} header exactly as it appeared in the diff
 * @param lines    body lines in diff order
 */
public record Hunk(
        int oldStart,
        int oldLines,
        int newStart,
        int newLines,
        String header,
        List<DiffLine> lines
) {
    public Hunk {
        Objects.requireNonNull(header, "header must not be null");
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public long count(LineType type) {
        return lines.stream().filter(line -> line.type() == type).count();
    }

    /**
     * Rebuilds the hunk body, one marker-prefixed line per entry.
     */
    public String bodyText() {
        return lines.stream()
                .map(DiffLine::toDiffText)
                .collect(Collectors.joining("\n"));
    }
}
