package com.ivamare.ogcapi.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.ivamare.ogcapi.exception.InvalidExecuteRequestException;
import com.ivamare.ogcapi.model.ExecuteRequest;
import com.ivamare.ogcapi.model.InputDescription;
import com.ivamare.ogcapi.model.ProcessDescription;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks the shape of an execute request against the process description: declared
 * input and output ids, required inputs and value counts. Values themselves are not
 * checked against their schema.
 */
public class ExecuteRequestValidator {

    private static final Set<String> RESPONSE_TYPES = Set.of("raw", "document");

    /**
     * @throws InvalidExecuteRequestException listing every violation found
     */
    public void validate(ProcessDescription process, ExecuteRequest request) {
        List<String> violations = new ArrayList<>();
        Map<String, InputDescription> declared = process.inputs();

        for (String inputId : request.inputs().keySet()) {
            if (!declared.containsKey(inputId)) {
                violations.add("Unknown input '" + inputId + "'");
            }
        }

        declared.forEach((inputId, input) -> {
            JsonNode value = request.inputs().get(inputId);
            int count = occurrences(value, input);
            if (count < input.effectiveMinOccurs()) {
                violations.add(count == 0
                    ? "Missing required input '" + inputId + "'"
                    : "Input '" + inputId + "' needs at least " + input.effectiveMinOccurs() + " values");
            }
            int max = input.effectiveMaxOccurs();
            if (max >= 0 && count > max) {
                violations.add("Input '" + inputId + "' accepts at most " + max + " values");
            }
        });

        if (request.outputs() != null) {
            for (String outputId : request.outputs().keySet()) {
                if (!process.outputs().containsKey(outputId)) {
                    violations.add("Unknown output '" + outputId + "'");
                }
            }
        }

        if (request.response() != null && !RESPONSE_TYPES.contains(request.response())) {
            violations.add("response must be 'raw' or 'document'");
        }

        if (!violations.isEmpty()) {
            throw new InvalidExecuteRequestException(process.id(), violations);
        }
    }

    // An array counts as several values only for inputs that accept more than one
    private static int occurrences(JsonNode value, InputDescription input) {
        if (value == null || value.isNull()) {
            return 0;
        }
        if (value.isArray() && input.effectiveMaxOccurs() != 1) {
            return value.size();
        }
        return 1;
    }
}
