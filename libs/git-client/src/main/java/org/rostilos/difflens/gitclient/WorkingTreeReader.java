package org.rostilos.difflens.gitclient;

/**
 * Reads file content straight from the working tree, bypassing git.
 */
public interface WorkingTreeReader {

    /**
     * @param path path relative to the repository root
     * @throws GitClientException if the file cannot be read
     */
    String read(String path);
}
