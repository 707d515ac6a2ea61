package org.rostilos.difflens.diff.parser;

import org.rostilos.difflens.diff.model.DiffLine;
import org.rostilos.difflens.diff.model.FileChange;
import org.rostilos.difflens.diff.model.FileStatus;
import org.rostilos.difflens.diff.model.Hunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code git diff} output into {@link FileChange} records.
 * <p>
 * The parser makes one forward pass over the text. Sections and hunks it cannot
 * interpret are skipped rather than failing the whole parse, since diff text is
 * often truncated or edited by hand. Instances hold no state between calls and can
 * be shared between threads.
 */
public class UnifiedDiffParser {

    private static final Logger log = LoggerFactory.getLogger(UnifiedDiffParser.class);

    static final String FILE_HEADER_PREFIX = "diff --git";

    private static final Pattern FILE_HEADER_PATTERN = Pattern.compile("^diff --git [a-z]/(.+) [a-z]/(.+)$", Pattern.DOTALL);

    private static final String NEW_FILE_PREFIX = "new file";
    private static final String DELETED_FILE_PREFIX = "deleted file";
    private static final String RENAME_FROM_PREFIX = "rename from";
    private static final String BINARY_PREFIX = "Binary files";

    /**
     * Parse a raw diff that may cover many files.
     *
     * @param rawDiff output of {@code git diff}; may be null or blank
     * @return file changes in the order their sections appear, never null
     */
    public List<FileChange> parse(String rawDiff) {
        if (rawDiff == null || rawDiff.isBlank()) {
            return Collections.emptyList();
        }

        LineCursor cursor = new LineCursor(splitLines(rawDiff));
        List<FileChange> files = new ArrayList<>();

        while (cursor.hasCurrent()) {
            if (cursor.current().startsWith(FILE_HEADER_PREFIX)) {
                files.add(parseFileSection(cursor));
            } else {
                cursor.advance();
            }
        }

        log.debug("Parsed {} file section(s) from {} diff line(s)", files.size(), cursor.size());
        return files;
    }

    private FileChange parseFileSection(LineCursor cursor) {
        FileSectionBuilder section = new FileSectionBuilder();

        String headerLine = cursor.current();
        Matcher pathMatcher = FILE_HEADER_PATTERN.matcher(headerLine);
        if (pathMatcher.matches()) {
            section.paths(pathMatcher.group(1), pathMatcher.group(2));
        } else {
            log.debug("File header without recognisable paths at line {}: {}", cursor.position() + 1, headerLine);
        }
        cursor.advance();

        while (cursor.hasCurrent() && !cursor.current().startsWith(FILE_HEADER_PREFIX)) {
            String line = cursor.current();

            if (line.startsWith(HunkHeader.PREFIX)) {
                // hunk parsing always moves the cursor past what it consumed
                parseHunk(cursor).ifPresent(section::addHunk);
                continue;
            }

            if (line.startsWith(NEW_FILE_PREFIX)) {
                section.status(FileStatus.ADDED);
            } else if (line.startsWith(DELETED_FILE_PREFIX)) {
                section.status(FileStatus.DELETED);
            } else if (line.startsWith(RENAME_FROM_PREFIX)) {
                section.renamedFrom(renameSource(line));
            } else if (line.startsWith(BINARY_PREFIX)) {
                section.binary();
            }
            cursor.advance();
        }

        if (section.isBinary() && section.hunkCount() > 0) {
            log.debug("Dropping {} hunk(s) of binary file {}", section.hunkCount(), section.path());
        }
        return section.build();
    }

    private Optional<Hunk> parseHunk(LineCursor cursor) {
        String headerLine = cursor.current();
        cursor.advance();

        Optional<HunkHeader> parsedHeader = HunkHeader.parse(headerLine);
        if (parsedHeader.isEmpty()) {
            log.debug("Skipping malformed hunk header at line {}: {}", cursor.position(), headerLine);
            return Optional.empty();
        }
        HunkHeader header = parsedHeader.get();

        int oldLine = header.oldStart();
        int newLine = header.newStart();
        List<DiffLine> lines = new ArrayList<>();

        while (cursor.hasCurrent()) {
            String line = cursor.current();
            if (line.startsWith(HunkHeader.PREFIX) || line.startsWith(FILE_HEADER_PREFIX)) {
                break;
            }
            cursor.advance();

            if (line.isEmpty()) {
                continue;
            }

            String content = line.substring(1);
            switch (line.charAt(0)) {
                case '+':
                    lines.add(DiffLine.added(newLine++, content));
                    break;
                case '-':
                    lines.add(DiffLine.deleted(oldLine++, content));
                    break;
                case ' ':
                    lines.add(DiffLine.context(oldLine++, newLine++, content));
                    break;
                default:
                    // "\ No newline at end of file" and anything unrecognised
                    break;
            }
        }

        return Optional.of(new Hunk(
                header.oldStart(),
                header.effectiveOldLines(),
                header.newStart(),
                header.effectiveNewLines(),
                header.raw(),
                lines
        ));
    }

    private static String renameSource(String line) {
        String source = line.substring(RENAME_FROM_PREFIX.length());
        // only the separator goes; spaces at the end belong to the file name
        return source.startsWith(" ") ? source.substring(1) : source;
    }

    private static List<String> splitLines(String rawDiff) {
        String[] lines = rawDiff.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].endsWith("\r")) {
                lines[i] = lines[i].substring(0, lines[i].length() - 1);
            }
        }
        return Arrays.asList(lines);
    }
}
