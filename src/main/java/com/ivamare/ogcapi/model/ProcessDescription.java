package com.ivamare.ogcapi.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full description of a process: the summary fields plus its inputs and outputs,
 * keyed by input/output identifier.
 */
public record ProcessDescription(
    @JsonUnwrapped ProcessSummary summary,
    Map<String, InputDescription> inputs,
    Map<String, OutputDescription> outputs
) {
    public ProcessDescription {
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    @JsonIgnore
    public String id() {
        return summary.id();
    }

    public ProcessDescription withLinks(List<Link> links) {
        return new ProcessDescription(summary.withLinks(links), inputs, outputs);
    }
}
