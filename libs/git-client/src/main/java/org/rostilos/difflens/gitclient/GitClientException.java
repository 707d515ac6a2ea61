package org.rostilos.difflens.gitclient;

/**
 * Exception thrown when git, or the working tree behind it, cannot deliver what was asked.
 */
public class GitClientException extends RuntimeException {

    public GitClientException(String message) {
        super(message);
    }

    public GitClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
