package org.rostilos.difflens.diff.parser;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed {@code @@ -a[,b] +c[,d] @@ heading} line.
 * <p>
 * Counts are kept optional so that an omitted count (which means 1) is not
 * confused with an explicit {@code ,0}.
 *
 * @param raw        the header line as it appeared
 * @param oldStart   first line in the old file
 * @param oldCount   line count in the old file, if written
 * @param newStart   first line in the new file
 * @param newCount   line count in the new file, if written
 * @param heading    text after the closing {@code @@}, usually the enclosing function
 */
public record HunkHeader(
        String raw,
        int oldStart,
        OptionalInt oldCount,
        int newStart,
        OptionalInt newCount,
        String heading
) {
    public static final String PREFIX = "@@";

    private static final Pattern HEADER_PATTERN =
            Pattern.compile("^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@(.*)$", Pattern.DOTALL);

    private static final int OMITTED_COUNT = 1;

    public HunkHeader {
        Objects.requireNonNull(raw, "raw must not be null");
        Objects.requireNonNull(oldCount, "oldCount must not be null");
        Objects.requireNonNull(newCount, "newCount must not be null");
        heading = heading == null ? "" : heading;
    }

    /**
     * @return the parsed header, or empty when the line is not a well-formed hunk header
     */
    public static Optional<HunkHeader> parse(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher matcher = HEADER_PATTERN.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new HunkHeader(
                    line,
                    Integer.parseInt(matcher.group(1)),
                    optionalNumber(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)),
                    optionalNumber(matcher.group(4)),
                    matcher.group(5)
            ));
        } catch (NumberFormatException e) {
            // digits only, so this is an int overflow
            return Optional.empty();
        }
    }

    public int effectiveOldLines() {
        return oldCount.orElse(OMITTED_COUNT);
    }

    public int effectiveNewLines() {
        return newCount.orElse(OMITTED_COUNT);
    }

    private static OptionalInt optionalNumber(String group) {
        return group == null ? OptionalInt.empty() : OptionalInt.of(Integer.parseInt(group));
    }
}
