package org.rostilos.difflens.gitclient.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DiffKind")
class DiffKindTest {

    @Test
    @DisplayName("should map each kind to its git diff arguments")
    void shouldMapBaseArguments() {
        assertThat(DiffKind.STAGED.getBaseArguments()).containsExactly("diff", "--cached");
        assertThat(DiffKind.UNSTAGED.getBaseArguments()).containsExactly("diff");
        assertThat(DiffKind.ALL.getBaseArguments()).containsExactly("diff", "HEAD");
    }

    @Test
    @DisplayName("should include untracked files only for working tree kinds")
    void shouldIncludeUntrackedForWorkingTreeKinds() {
        assertThat(DiffKind.STAGED.includesUntracked()).isFalse();
        assertThat(DiffKind.UNSTAGED.includesUntracked()).isTrue();
        assertThat(DiffKind.ALL.includesUntracked()).isTrue();
    }
}
