package org.rostilos.difflens.gitclient.model;

import java.util.List;

/**
 * Which set of changes a diff covers.
 */
public enum DiffKind {
    /** Index against HEAD ({@code git diff --cached}). */
    STAGED(List.of("diff", "--cached")),
    /** Working tree against index ({@code git diff}). */
    UNSTAGED(List.of("diff")),
    /** Working tree against HEAD ({@code git diff HEAD}). */
    ALL(List.of("diff", "HEAD"));

    private final List<String> baseArguments;

    DiffKind(List<String> baseArguments) {
        this.baseArguments = baseArguments;
    }

    public List<String> getBaseArguments() {
        return baseArguments;
    }

    /**
     * Whether files git does not track yet belong in this kind of diff.
     */
    public boolean includesUntracked() {
        return this != STAGED;
    }
}
