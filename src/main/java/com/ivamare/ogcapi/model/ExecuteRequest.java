package com.ivamare.ogcapi.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of an execution request.
 *
 * @param inputs Input values keyed by input identifier
 * @param outputs Requested outputs keyed by output identifier (nullable)
 * @param response Requested response form, "raw" or "document" (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecuteRequest(
    Map<String, JsonNode> inputs,
    Map<String, JsonNode> outputs,
    String response
) {
    public ExecuteRequest {
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    public static ExecuteRequest of(Map<String, JsonNode> inputs) {
        return new ExecuteRequest(inputs, null, null);
    }
}
