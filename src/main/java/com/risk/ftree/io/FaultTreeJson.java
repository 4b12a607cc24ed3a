package com.risk.ftree.io;

import java.io.IOException;
import java.io.Reader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads and writes {@link FaultTreeDefinition}s as JSON.
 *
 * <p>
 * Expected shape:
 *
 * <pre>
 * { "faultTree": {
 *     "name": "pumps",
 *     "gates": [ { "name": "TOP", "operator": "atleast", "k": 2, "arguments": ["A", "B", "C"] } ],
 *     "basicEvents": [ { "name": "A", "probability": 0.01 } ],
 *     "houseEvents": [ { "name": "H", "state": true } ],
 *     "ccfGroups": [ { "name": "CCF", "model": "MGL", "probability": 0.1,
 *                      "members": ["A", "B"], "factors": [0.1, 0.05] } ] } }
 * </pre>
 */
public final class FaultTreeJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FaultTreeJson() {
        // Utility class
    }

    /**
     * Parses a JSON string into a FaultTreeDefinition.
     *
     * @throws IllegalArgumentException if the JSON is malformed or has no
     *                                  {@code faultTree} key.
     */
    public static FaultTreeDefinition parse(String json) {
        try {
            return requireModel(MAPPER.readValue(json, FaultTreeDefinition.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed fault tree JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses JSON from a reader into a FaultTreeDefinition.
     *
     * @throws IOException if reading fails or the JSON is malformed.
     */
    public static FaultTreeDefinition parse(Reader reader) throws IOException {
        return requireModel(MAPPER.readValue(reader, FaultTreeDefinition.class));
    }

    /** Serializes a definition back to pretty-printed JSON. */
    public static String write(FaultTreeDefinition definition) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize fault tree definition", e);
        }
    }

    private static FaultTreeDefinition requireModel(FaultTreeDefinition def) {
        if (def == null || def.getFaultTree() == null)
            throw new IllegalArgumentException("Missing 'faultTree' key");
        return def;
    }
}
