package org.rostilos.difflens.gitclient.command;

import org.rostilos.difflens.gitclient.GitClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * {@link GitCommandRunner} that starts the git executable as a child process.
 */
public class ProcessGitCommandRunner implements GitCommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessGitCommandRunner.class);

    private final String executable;
    private final Path workingDirectory;
    private final Duration timeout;

    public ProcessGitCommandRunner(String executable, Path workingDirectory, Duration timeout) {
        this.executable = Objects.requireNonNull(executable, "executable must not be null");
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public String run(List<String> arguments) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(arguments);
        log.debug("Running {} in {}", command, workingDirectory);

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workingDirectory.toFile())
                    .start();
        } catch (IOException e) {
            throw new GitClientException("Failed to start " + executable + ": " + e.getMessage(), e);
        }

        // each pipe gets its own thread so neither can fill up while the other is read
        ExecutorService pipeReaders = Executors.newFixedThreadPool(2);
        try {
            CompletableFuture<String> stdout =
                    CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()), pipeReaders);
            CompletableFuture<String> stderr =
                    CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()), pipeReaders);

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new GitClientException("git " + String.join(" ", arguments) + " timed out after " + timeout);
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new GitClientException("git command failed (exit " + exitCode + "): " + stderr.get().trim());
            }
            return stdout.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new GitClientException("Interrupted while waiting for git", e);
        } catch (ExecutionException e) {
            throw new GitClientException("Failed to read git output", e);
        } finally {
            pipeReaders.shutdown();
        }
    }

    private static String readFully(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
