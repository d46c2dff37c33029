package org.netpreserve.fedicrawl.checkpoint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Free-form string attributes attached to a checkpoint, such as the crawl status at the time it was taken.
 */
public record CheckpointMetadata(Map<String, String> values) {
    private static final ObjectMapper JSON = new ObjectMapper();
    public static final String STATUS = "status";
    public static final CheckpointMetadata EMPTY = new CheckpointMetadata(Map.of());

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public CheckpointMetadata {
        values = values == null ? Map.of() : Map.copyOf(values);
    }

    public static CheckpointMetadata parse(String json) {
        try {
            return new CheckpointMetadata(JSON.readValue(json, new TypeReference<LinkedHashMap<String, String>>() {
            }));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid checkpoint metadata: " + json, e);
        }
    }

    @JsonValue
    public Map<String, String> values() {
        return values;
    }

    @Nullable
    public String get(String key) {
        return values.get(key);
    }

    public String toJson() {
        try {
            return JSON.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }
}
