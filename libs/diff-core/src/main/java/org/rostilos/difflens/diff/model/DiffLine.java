package org.rostilos.difflens.diff.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * One line of a hunk body.
 * <p>
 * Each variant carries only the line numbers that exist for it: context lines
 * are present on both sides, added lines only in the new file and deleted
 * lines only in the old one. Content never includes the leading marker.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DiffLine.Context.class, name = "context"),
        @JsonSubTypes.Type(value = DiffLine.Added.class, name = "added"),
        @JsonSubTypes.Type(value = DiffLine.Deleted.class, name = "deleted")
})
public sealed interface DiffLine permits DiffLine.Context, DiffLine.Added, DiffLine.Deleted {

    LineType type();

    String content();

    OptionalInt oldNumber();

    OptionalInt newNumber();

    /**
     * The line as it appears in the diff body, marker included.
     */
    default String toDiffText() {
        return type().getMarker() + content();
    }

    static Context context(int oldLine, int newLine, String content) {
        return new Context(oldLine, newLine, content);
    }

    static Added added(int newLine, String content) {
        return new Added(newLine, content);
    }

    static Deleted deleted(int oldLine, String content) {
        return new Deleted(oldLine, content);
    }

    record Context(
            @JsonProperty("oldNumber") int oldLine,
            @JsonProperty("newNumber") int newLine,
            @JsonProperty("content") String content
    ) implements DiffLine {
        public Context {
            Objects.requireNonNull(content, "content must not be null");
        }

        @Override
        public LineType type() {
            return LineType.CONTEXT;
        }

        @Override
        public OptionalInt oldNumber() {
            return OptionalInt.of(oldLine);
        }

        @Override
        public OptionalInt newNumber() {
            return OptionalInt.of(newLine);
        }
    }

    record Added(
            @JsonProperty("newNumber") int newLine,
            @JsonProperty("content") String content
    ) implements DiffLine {
        public Added {
            Objects.requireNonNull(content, "content must not be null");
        }

        @Override
        public LineType type() {
            return LineType.ADDED;
        }

        @Override
        public OptionalInt oldNumber() {
            return OptionalInt.empty();
        }

        @Override
        public OptionalInt newNumber() {
            return OptionalInt.of(newLine);
        }
    }

    record Deleted(
            @JsonProperty("oldNumber") int oldLine,
            @JsonProperty("content") String content
    ) implements DiffLine {
        public Deleted {
            Objects.requireNonNull(content, "content must not be null");
        }

        @Override
        public LineType type() {
            return LineType.DELETED;
        }

        @Override
        public OptionalInt oldNumber() {
            return OptionalInt.of(oldLine);
        }

        @Override
        public OptionalInt newNumber() {
            return OptionalInt.empty();
        }
    }
}
