package org.rostilos.difflens.gitclient.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "difflens.git")
public class GitClientProperties {

    private String executable = "git";
    private String repositoryPath = ".";
    private int defaultContextLines = 3;
    private Duration commandTimeout = Duration.ofSeconds(30);
    private boolean includeUntracked = true;

    public String getExecutable() {
        return executable;
    }

    public void setExecutable(String executable) {
        this.executable = executable;
    }

    public String getRepositoryPath() {
        return repositoryPath;
    }

    public void setRepositoryPath(String repositoryPath) {
        this.repositoryPath = repositoryPath;
    }

    public int getDefaultContextLines() {
        return defaultContextLines;
    }

    public void setDefaultContextLines(int defaultContextLines) {
        this.defaultContextLines = defaultContextLines;
    }

    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public void setCommandTimeout(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
    }

    public boolean isIncludeUntracked() {
        return includeUntracked;
    }

    public void setIncludeUntracked(boolean includeUntracked) {
        this.includeUntracked = includeUntracked;
    }
}
