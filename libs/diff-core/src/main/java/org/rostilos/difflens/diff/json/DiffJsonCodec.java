package org.rostilos.difflens.diff.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.rostilos.difflens.diff.model.FileChange;

import java.util.List;
import java.util.Objects;

/**
 * JSON form of parsed diffs, for handing them to consumers outside the JVM.
 */
public class DiffJsonCodec {

    private static final TypeReference<List<FileChange>> FILE_CHANGES = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public DiffJsonCodec() {
        this(new ObjectMapper());
    }

    public DiffJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public String toJson(List<FileChange> files) {
        try {
            return objectMapper.writeValueAsString(files);
        } catch (JsonProcessingException e) {
            throw new DiffCodecException("Failed to serialize file changes", e);
        }
    }

    public List<FileChange> fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new DiffCodecException("JSON input is empty");
        }
        try {
            return objectMapper.readValue(json, FILE_CHANGES);
        } catch (JsonProcessingException e) {
            throw new DiffCodecException("Failed to deserialize file changes", e);
        }
    }
}
