package com.ivamare.ogcapi.handler.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ivamare.ogcapi.handler.JobContext;
import com.ivamare.ogcapi.handler.ProcessHandler;
import com.ivamare.ogcapi.model.ExecuteRequest;
import com.ivamare.ogcapi.model.InputDescription;
import com.ivamare.ogcapi.model.JobControlOption;
import com.ivamare.ogcapi.model.OutputDescription;
import com.ivamare.ogcapi.model.ProcessDescription;
import com.ivamare.ogcapi.model.ProcessSummary;
import com.ivamare.ogcapi.model.TransmissionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Returns its inputs as its result. An optional {@code delay} input (milliseconds)
 * keeps the job running for that long, reporting progress and honouring dismissal.
 */
public class EchoProcessHandler implements ProcessHandler {

    private static final Logger log = LoggerFactory.getLogger(EchoProcessHandler.class);

    public static final String PROCESS_ID = "echo";
    public static final String VALUE_INPUT = "value";
    public static final String DELAY_INPUT = "delay";

    private static final long TICK_MILLIS = 50;
    private static final long MAX_DELAY_MILLIS = 600_000;

    private final ObjectMapper objectMapper;
    private final ProcessDescription description;

    public EchoProcessHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.description = buildDescription(objectMapper);
    }

    @Override
    public ProcessDescription description() {
        return description;
    }

    @Override
    public JsonNode execute(ExecuteRequest request, JobContext context) throws Exception {
        long delay = delayOf(request.inputs().get(DELAY_INPUT));
        if (delay > 0) {
            waitFor(delay, context);
        }

        ObjectNode result = objectMapper.createObjectNode();
        request.inputs().forEach((name, value) -> {
            if (!DELAY_INPUT.equals(name)) {
                result.set(name, value);
            }
        });
        return result;
    }

    private void waitFor(long delay, JobContext context) throws InterruptedException {
        long waited = 0;
        int lastReported = -1;
        while (waited < delay) {
            if (context.isCancelled()) {
                log.debug("Echo job {} cancelled after {}ms", context.jobId(), waited);
                return;
            }
            long step = Math.min(TICK_MILLIS, delay - waited);
            Thread.sleep(step);
            waited += step;

            int percent = (int) (waited * 100 / delay);
            if (percent / 10 != lastReported / 10) {
                context.reportProgress(percent, "Echoing");
                lastReported = percent;
            }
        }
    }

    private static long delayOf(JsonNode node) {
        if (node == null || node.isNull()) {
            return 0;
        }
        if (!node.canConvertToLong() || node.asLong() < 0) {
            throw new IllegalArgumentException("delay must be a non-negative number of milliseconds");
        }
        return Math.min(node.asLong(), MAX_DELAY_MILLIS);
    }

    private static ProcessDescription buildDescription(ObjectMapper mapper) {
        ProcessSummary summary = new ProcessSummary(
            PROCESS_ID,
            "Echo",
            "Returns the provided inputs as the result.",
            "1.0.0",
            List.of(JobControlOption.SYNC_EXECUTE, JobControlOption.ASYNC_EXECUTE, JobControlOption.DISMISS),
            List.of(TransmissionMode.VALUE),
            null
        );

        Map<String, InputDescription> inputs = new LinkedHashMap<>();
        inputs.put(VALUE_INPUT, new InputDescription(
            "Value",
            "Any JSON value, returned unchanged.",
            0,
            null,
            mapper.createObjectNode()
        ));
        inputs.put(DELAY_INPUT, new InputDescription(
            "Delay",
            "Milliseconds to wait before answering.",
            0,
            null,
            mapper.createObjectNode().put("type", "integer").put("minimum", 0)
        ));

        Map<String, OutputDescription> outputs = Map.of(VALUE_INPUT, new OutputDescription(
            "Value",
            "The echoed value.",
            mapper.createObjectNode()
        ));

        return new ProcessDescription(summary, inputs, outputs);
    }
}
