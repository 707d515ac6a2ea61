package org.rostilos.difflens.gitclient.command;

import java.util.List;

/**
 * Runs a git subcommand in the configured repository and returns its standard output.
 */
public interface GitCommandRunner {

    /**
     * @param arguments arguments after the git executable, e.g. {@code ["status", "--porcelain"]}
     * @return everything the command wrote to standard output
     * @throws org.rostilos.difflens.gitclient.GitClientException if git cannot be started,
     *         times out or exits with a non-zero status
     */
    String run(List<String> arguments);
}
