package org.rostilos.difflens.gitclient;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemWorkingTreeReaderTest {

    @TempDir
    Path root;

    @Test
    void testReadsFileRelativeToRoot() throws Exception {
        Files.createDirectories(root.resolve("src"));
        Files.writeString(root.resolve("src/Main.java"), "class Main {}\n");

        WorkingTreeReader reader = new FileSystemWorkingTreeReader(root);

        assertThat(reader.read("src/Main.java")).isEqualTo("class Main {}\n");
    }

    @Test
    void testMissingFileThrowsGitClientException() {
        WorkingTreeReader reader = new FileSystemWorkingTreeReader(root);

        assertThatThrownBy(() -> reader.read("nope.txt"))
                .isInstanceOf(GitClientException.class)
                .hasMessage("Failed to read file nope.txt")
                .hasCauseInstanceOf(java.io.IOException.class);
    }

    @Test
    void testPathOutsideRootIsRejected() {
        WorkingTreeReader reader = new FileSystemWorkingTreeReader(root);

        assertThatThrownBy(() -> reader.read("../outside.txt"))
                .isInstanceOf(GitClientException.class)
                .hasMessageContaining("escapes");
    }
}
