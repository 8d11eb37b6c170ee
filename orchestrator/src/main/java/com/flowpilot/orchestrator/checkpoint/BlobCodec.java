package com.flowpilot.orchestrator.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpilot.orchestrator.workflow.WorkflowDefinition;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON encoding for the opaque blob columns (definition, context, metadata,
 * step input/output).
 *
 * Values round-trip structurally: maps come back as maps, lists as lists,
 * numbers as the narrowest Jackson type. Arbitrary Java objects are written
 * through their bean properties and read back as maps.
 */
public class BlobCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper json;

    public BlobCodec(ObjectMapper json) {
        this.json = json;
    }

    public String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Cannot serialize " + value.getClass().getName() + ": " + e.getOriginalMessage(), e);
        }
    }

    public Map<String, Object> readMap(String blob) {
        if (blob == null || blob.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return json.readValue(blob, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Corrupt map blob", e);
        }
    }

    public Object readValue(String blob) {
        if (blob == null) {
            return null;
        }
        try {
            return json.readValue(blob, Object.class);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Corrupt value blob", e);
        }
    }

    public WorkflowDefinition readDefinition(String blob) {
        try {
            return json.readValue(blob, WorkflowDefinition.class);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Corrupt workflow definition blob", e);
        }
    }
}
