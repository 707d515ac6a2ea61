package org.rostilos.difflens.gitclient.config;

import org.rostilos.difflens.diff.parser.UnifiedDiffParser;
import org.rostilos.difflens.gitclient.DiffProvider;
import org.rostilos.difflens.gitclient.FileSystemWorkingTreeReader;
import org.rostilos.difflens.gitclient.GitDiffProvider;
import org.rostilos.difflens.gitclient.GitDiffService;
import org.rostilos.difflens.gitclient.UntrackedFileDiffFactory;
import org.rostilos.difflens.gitclient.WorkingTreeReader;
import org.rostilos.difflens.gitclient.command.GitCommandRunner;
import org.rostilos.difflens.gitclient.command.ProcessGitCommandRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;

@AutoConfiguration
@EnableConfigurationProperties(GitClientProperties.class)
public class GitClientAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public UnifiedDiffParser unifiedDiffParser() {
        return new UnifiedDiffParser();
    }

    @Bean
    @ConditionalOnMissingBean
    public GitCommandRunner gitCommandRunner(GitClientProperties properties) {
        return new ProcessGitCommandRunner(
                properties.getExecutable(),
                repositoryRoot(properties),
                properties.getCommandTimeout()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkingTreeReader workingTreeReader(GitClientProperties properties) {
        return new FileSystemWorkingTreeReader(repositoryRoot(properties));
    }

    @Bean
    @ConditionalOnMissingBean
    public DiffProvider diffProvider(GitCommandRunner gitCommandRunner, WorkingTreeReader workingTreeReader) {
        return new GitDiffProvider(gitCommandRunner, workingTreeReader);
    }

    @Bean
    @ConditionalOnMissingBean
    public GitDiffService gitDiffService(
            DiffProvider diffProvider,
            UnifiedDiffParser unifiedDiffParser,
            GitClientProperties properties
    ) {
        return new GitDiffService(
                diffProvider,
                unifiedDiffParser,
                new UntrackedFileDiffFactory(),
                properties.getDefaultContextLines(),
                properties.isIncludeUntracked()
        );
    }

    private static Path repositoryRoot(GitClientProperties properties) {
        return Path.of(properties.getRepositoryPath()).toAbsolutePath().normalize();
    }
}
