package org.rostilos.difflens.gitclient;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rostilos.difflens.diff.model.DiffLine;
import org.rostilos.difflens.diff.model.FileChange;
import org.rostilos.difflens.diff.model.FileStatus;
import org.rostilos.difflens.diff.model.Hunk;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("UntrackedFileDiffFactory")
class UntrackedFileDiffFactoryTest {

    private final UntrackedFileDiffFactory factory = new UntrackedFileDiffFactory();

    @Test
    @DisplayName("should mark every line of a five line file as added")
    void shouldSynthesizeFiveLineFile() {
        FileChange file = factory.synthesize("notes.txt", "one\ntwo\nthree\nfour\nfive\n");

        assertThat(file.path()).isEqualTo("notes.txt");
        assertThat(file.status()).isEqualTo(FileStatus.ADDED);
        assertThat(file.binary()).isFalse();
        assertThat(file.additions()).isEqualTo(5);
        assertThat(file.deletions()).isZero();
        assertThat(file.hunks()).hasSize(1);

        Hunk hunk = file.hunks().get(0);
        assertThat(hunk.oldStart()).isZero();
        assertThat(hunk.oldLines()).isZero();
        assertThat(hunk.newStart()).isEqualTo(1);
        assertThat(hunk.newLines()).isEqualTo(5);
        assertThat(hunk.header()).isEqualTo("@@ -0,0 +1,5 @@");
        assertThat(hunk.lines()).containsExactly(
                DiffLine.added(1, "one"),
                DiffLine.added(2, "two"),
                DiffLine.added(3, "three"),
                DiffLine.added(4, "four"),
                DiffLine.added(5, "five")
        );
    }

    @Test
    @DisplayName("should keep last line without trailing newline")
    void shouldKeepUnterminatedLastLine() {
        FileChange file = factory.synthesize("a.txt", "first\r\nsecond");

        assertThat(file.hunks().get(0).lines()).containsExactly(
                DiffLine.added(1, "first"),
                DiffLine.added(2, "second")
        );
    }

    @Test
    @DisplayName("should keep blank lines as empty additions")
    void shouldKeepBlankLines() {
        FileChange file = factory.synthesize("a.txt", "x\n\ny\n");

        assertThat(file.additions()).isEqualTo(3);
        assertThat(file.hunks().get(0).lines().get(1)).isEqualTo(DiffLine.added(2, ""));
    }

    @Test
    @DisplayName("should produce an empty hunk for an empty file")
    void shouldHandleEmptyFile() {
        FileChange file = factory.synthesize("empty.txt", "");

        assertThat(file.additions()).isZero();
        assertThat(file.hunks()).hasSize(1);
        assertThat(file.hunks().get(0).lines()).isEmpty();
        assertThat(file.hunks().get(0).header()).isEqualTo("@@ -0,0 +1,0 @@");
    }
}
