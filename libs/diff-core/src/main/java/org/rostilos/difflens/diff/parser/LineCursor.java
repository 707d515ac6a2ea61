package org.rostilos.difflens.diff.parser;

import java.util.List;

/**
 * Forward-only position over the lines of one diff text.
 */
final class LineCursor {

    private final List<String> lines;
    private int position;

    LineCursor(List<String> lines) {
        this.lines = lines;
    }

    boolean hasCurrent() {
        return position < lines.size();
    }

    String current() {
        return lines.get(position);
    }

    void advance() {
        position++;
    }

    int position() {
        return position;
    }

    int size() {
        return lines.size();
    }
}
