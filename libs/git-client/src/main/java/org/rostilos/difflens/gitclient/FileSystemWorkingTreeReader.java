package org.rostilos.difflens.gitclient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

public class FileSystemWorkingTreeReader implements WorkingTreeReader {

    private final Path root;

    public FileSystemWorkingTreeReader(Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    @Override
    public String read(String path) {
        Path file = root.resolve(path).normalize();
        if (!file.startsWith(root.normalize())) {
            throw new GitClientException("Path escapes the repository: " + path);
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new GitClientException("Failed to read file " + path, e);
        }
    }
}
