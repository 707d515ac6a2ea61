package org.rostilos.difflens.gitclient;

import org.rostilos.difflens.diff.model.DiffLine;
import org.rostilos.difflens.diff.model.FileChange;
import org.rostilos.difflens.diff.model.FileStatus;
import org.rostilos.difflens.diff.model.Hunk;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the change record of a file git does not track yet: every line is an addition.
 */
public class UntrackedFileDiffFactory {

    public FileChange synthesize(String path, String content) {
        List<String> contentLines = splitContent(content);

        List<DiffLine> lines = new ArrayList<>(contentLines.size());
        for (int i = 0; i < contentLines.size(); i++) {
            lines.add(DiffLine.added(i + 1, contentLines.get(i)));
        }

        int lineCount = lines.size();
        Hunk hunk = new Hunk(0, 0, 1, lineCount, String.format("@@ -0,0 +1,%d @@", lineCount), lines);
        return FileChange.of(path, path, FileStatus.ADDED, false, List.of(hunk));
    }

    private static List<String> splitContent(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        String body = content.endsWith("\n") ? content.substring(0, content.length() - 1) : content;
        List<String> result = new ArrayList<>();
        for (String line : body.split("\n", -1)) {
            result.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        return result;
    }
}
