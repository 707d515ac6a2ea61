package org.rostilos.difflens.diff.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Hunk")
class HunkTest {

    @Test
    @DisplayName("should count lines by type")
    void shouldCountByType() {
        Hunk hunk = new Hunk(3, 2, 3, 2, "@@ -3,2 +3,2 @@", List.of(
                DiffLine.deleted(3, "a"),
                DiffLine.added(3, "b"),
                DiffLine.context(4, 4, "c")
        ));

        assertThat(hunk.count(LineType.ADDED)).isEqualTo(1);
        assertThat(hunk.count(LineType.DELETED)).isEqualTo(1);
        assertThat(hunk.count(LineType.CONTEXT)).isEqualTo(1);
        assertThat(hunk.bodyText()).isEqualTo("-a\n+b\n c");
    }

    @Test
    @DisplayName("should treat null lines as empty")
    void shouldTreatNullLinesAsEmpty() {
        Hunk hunk = new Hunk(0, 0, 1, 0, "@@ -0,0 +1,0 @@", null);

        assertThat(hunk.lines()).isEmpty();
        assertThat(hunk.bodyText()).isEmpty();
    }
}
