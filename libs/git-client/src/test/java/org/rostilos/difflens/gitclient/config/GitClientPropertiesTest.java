package org.rostilos.difflens.gitclient.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class GitClientPropertiesTest {

    @Test
    void testDefaultValues() {
        GitClientProperties properties = new GitClientProperties();

        assertThat(properties.getExecutable()).isEqualTo("git");
        assertThat(properties.getRepositoryPath()).isEqualTo(".");
        assertThat(properties.getDefaultContextLines()).isEqualTo(3);
        assertThat(properties.getCommandTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(properties.isIncludeUntracked()).isTrue();
    }

    @Test
    void testAllPropertiesCanBeSet() {
        GitClientProperties properties = new GitClientProperties();

        properties.setExecutable("/usr/local/bin/git");
        properties.setRepositoryPath("/srv/repo");
        properties.setDefaultContextLines(10);
        properties.setCommandTimeout(Duration.ofMinutes(2));
        properties.setIncludeUntracked(false);

        assertThat(properties.getExecutable()).isEqualTo("/usr/local/bin/git");
        assertThat(properties.getRepositoryPath()).isEqualTo("/srv/repo");
        assertThat(properties.getDefaultContextLines()).isEqualTo(10);
        assertThat(properties.getCommandTimeout()).isEqualTo(Duration.ofMinutes(2));
        assertThat(properties.isIncludeUntracked()).isFalse();
    }
}
