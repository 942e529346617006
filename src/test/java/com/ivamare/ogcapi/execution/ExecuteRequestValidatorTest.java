package com.ivamare.ogcapi.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import com.ivamare.ogcapi.exception.InvalidExecuteRequestException;
import com.ivamare.ogcapi.model.ExecuteRequest;
import com.ivamare.ogcapi.model.InputDescription;
import com.ivamare.ogcapi.model.OutputDescription;
import com.ivamare.ogcapi.model.ProcessDescription;
import com.ivamare.ogcapi.model.ProcessSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExecuteRequestValidator")
class ExecuteRequestValidatorTest {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final ExecuteRequestValidator validator = new ExecuteRequestValidator();

    // geometry: required, single value; distances: 1..3 values; label: optional, unbounded
    private static ProcessDescription bufferProcess() {
        Map<String, InputDescription> inputs = new LinkedHashMap<>();
        inputs.put("geometry", new InputDescription("Geometry", null, null, null, null));
        inputs.put("distances", new InputDescription("Distances", null, 1, IntNode.valueOf(3), null));
        inputs.put("label", new InputDescription("Label", null, 0, TextNode.valueOf("unbounded"), null));
        return new ProcessDescription(
            new ProcessSummary("buffer", "Buffer", null, null, null, null, null),
            inputs,
            Map.of("buffered", new OutputDescription("Buffered", null, null)));
    }

    private static ExecuteRequest request(Map<String, JsonNode> inputs) {
        return ExecuteRequest.of(inputs);
    }

    @Test
    @DisplayName("should accept a request matching the description")
    void shouldAcceptMatchingRequest() {
        assertDoesNotThrow(() -> validator.validate(bufferProcess(), request(Map.of(
            "geometry", JSON.objectNode().put("type", "Point"),
            "distances", JSON.arrayNode().add(1).add(2)))));
    }

    @Test
    @DisplayName("should report every violation at once")
    void shouldReportEveryViolation() {
        ExecuteRequest request = new ExecuteRequest(
            Map.of("colour", TextNode.valueOf("red")),
            Map.of("area", JSON.objectNode()),
            "stream");

        InvalidExecuteRequestException ex = assertThrows(InvalidExecuteRequestException.class,
            () -> validator.validate(bufferProcess(), request));

        assertEquals("buffer", ex.getProcessId());
        assertTrue(ex.getViolations().contains("Unknown input 'colour'"));
        assertTrue(ex.getViolations().contains("Missing required input 'geometry'"));
        assertTrue(ex.getViolations().contains("Missing required input 'distances'"));
        assertTrue(ex.getViolations().contains("Unknown output 'area'"));
        assertTrue(ex.getViolations().contains("response must be 'raw' or 'document'"));
        assertEquals(5, ex.getViolations().size());
    }

    @Test
    @DisplayName("should enforce the maximum number of values")
    void shouldEnforceMaxOccurs() {
        ExecuteRequest request = request(Map.of(
            "geometry", JSON.objectNode(),
            "distances", JSON.arrayNode().add(1).add(2).add(3).add(4)));

        InvalidExecuteRequestException ex = assertThrows(InvalidExecuteRequestException.class,
            () -> validator.validate(bufferProcess(), request));

        assertEquals(List.of("Input 'distances' accepts at most 3 values"), ex.getViolations());
    }

    @Test
    @DisplayName("an array for a single-valued input should count as one value")
    void arrayForSingleValuedInputIsOneValue() {
        assertDoesNotThrow(() -> validator.validate(bufferProcess(), request(Map.of(
            "geometry", JSON.arrayNode().add(1).add(2),
            "distances", IntNode.valueOf(5)))));
    }

    @Test
    @DisplayName("an empty array should not satisfy a required input")
    void emptyArrayShouldNotSatisfyRequiredInput() {
        InvalidExecuteRequestException ex = assertThrows(InvalidExecuteRequestException.class,
            () -> validator.validate(bufferProcess(), request(Map.of(
                "geometry", JSON.objectNode(),
                "distances", JSON.arrayNode()))));

        assertEquals(List.of("Missing required input 'distances'"), ex.getViolations());
    }

    @Test
    @DisplayName("should accept unbounded inputs with many values")
    void shouldAcceptUnboundedInputs() {
        assertDoesNotThrow(() -> validator.validate(bufferProcess(), new ExecuteRequest(Map.of(
            "geometry", JSON.objectNode(),
            "distances", IntNode.valueOf(1),
            "label", JSON.arrayNode().add("a").add("b").add("c").add("d")),
            Map.of("buffered", JSON.objectNode()),
            "document")));
    }
}
