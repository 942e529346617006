package com.ivamare.ogcapi.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Declared process input.
 *
 * @param title Short title
 * @param description Longer description (nullable)
 * @param minOccurs Minimum number of values; defaults to 1
 * @param maxOccurs Maximum number of values, a number or "unbounded"; defaults to 1
 * @param schema JSON schema of a single value (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record InputDescription(
    String title,
    String description,
    Integer minOccurs,
    JsonNode maxOccurs,
    JsonNode schema
) {
    public int effectiveMinOccurs() {
        return minOccurs != null ? minOccurs : 1;
    }

    /**
     * @return maximum number of values, or -1 when unbounded
     */
    public int effectiveMaxOccurs() {
        if (maxOccurs == null || maxOccurs.isNull()) {
            return 1;
        }
        if (maxOccurs.isNumber()) {
            return maxOccurs.asInt();
        }
        return -1;
    }

    public boolean isRequired() {
        return effectiveMinOccurs() > 0;
    }
}
