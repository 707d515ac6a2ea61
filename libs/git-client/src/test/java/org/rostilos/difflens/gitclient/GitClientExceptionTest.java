package org.rostilos.difflens.gitclient;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GitClientException")
class GitClientExceptionTest {

    @Test
    @DisplayName("should create exception with message")
    void shouldCreateExceptionWithMessage() {
        GitClientException exception = new GitClientException("git not found");

        assertThat(exception.getMessage()).isEqualTo("git not found");
        assertThat(exception.getCause()).isNull();
        assertThat(exception).isInstanceOf(RuntimeException.class);
    }

    @Test
    @DisplayName("should preserve cause chain")
    void shouldPreserveCauseChain() {
        IllegalStateException root = new IllegalStateException("root");
        GitClientException inner = new GitClientException("inner", root);
        GitClientException outer = new GitClientException("outer", inner);

        assertThat(outer.getCause()).isSameAs(inner);
        assertThat(outer.getCause().getCause()).isSameAs(root);
    }
}
