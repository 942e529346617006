package com.ivamare.ogcapi.execution.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.ivamare.ogcapi.execution.JobCompletionCallback;
import com.ivamare.ogcapi.execution.JobRunner;
import com.ivamare.ogcapi.execution.JobTask;
import com.ivamare.ogcapi.handler.HandlerRegistry;
import com.ivamare.ogcapi.handler.JobContext;
import com.ivamare.ogcapi.handler.ProcessHandler;
import com.ivamare.ogcapi.model.ExecuteRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("ExecutorJobDispatcher")
class ExecutorJobDispatcherTest {

    private ProcessHandler handler;
    private JobCompletionCallback callback;
    private ExecutorJobDispatcher dispatcher;

    private final CountDownLatch release = new CountDownLatch(1);
    private final CountDownLatch started = new CountDownLatch(1);

    @BeforeEach
    void setUp() throws Exception {
        HandlerRegistry handlerRegistry = mock(HandlerRegistry.class);
        handler = mock(ProcessHandler.class);
        callback = mock(JobCompletionCallback.class);
        when(handlerRegistry.getOrThrow("slow")).thenReturn(handler);
        when(callback.onStart(anyString())).thenReturn(true);
        when(handler.execute(any(), any())).thenAnswer(invocation -> {
            JobContext context = invocation.getArgument(1);
            started.countDown();
            while (!release.await(10, TimeUnit.MILLISECONDS)) {
                if (context.isCancelled()) {
                    throw new InterruptedException("cancelled");
                }
            }
            return JsonNodeFactory.instance.objectNode().put("done", true);
        });

        dispatcher = new ExecutorJobDispatcher(new JobRunner(handlerRegistry), 1, 1);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        dispatcher.stopNow();
    }

    private static JobTask task(String jobId) {
        return new JobTask(jobId, "slow", ExecuteRequest.of(Map.of()));
    }

    @Test
    @DisplayName("should validate its sizing")
    void shouldValidateSizing() {
        JobRunner runner = mock(JobRunner.class);
        assertThrows(IllegalArgumentException.class, () -> new ExecutorJobDispatcher(runner, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new ExecutorJobDispatcher(runner, 1, 0));
    }

    @Test
    @DisplayName("should refuse work before it is started")
    void shouldRefuseWorkBeforeStart() {
        assertFalse(dispatcher.isRunning());
        assertFalse(dispatcher.dispatch(task("job-1"), callback));
        assertFalse(dispatcher.isTracked("job-1"));
    }

    @Test
    @DisplayName("should run a dispatched job and stop tracking it afterwards")
    void shouldRunDispatchedJob() throws Exception {
        dispatcher.start();

        assertTrue(dispatcher.dispatch(task("job-1"), callback));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(dispatcher.isTracked("job-1"));
        assertEquals(1, dispatcher.inFlightCount());

        release.countDown();

        verify(callback, timeout(5000)).onSuccess(eq("job-1"), any(JsonNode.class));
        waitUntil(() -> !dispatcher.isTracked("job-1"));
        assertEquals(0, dispatcher.inFlightCount());
    }

    @Test
    @DisplayName("should reject work once the queue is full")
    void shouldRejectWhenQueueFull() throws Exception {
        dispatcher.start();

        assertTrue(dispatcher.dispatch(task("job-1"), callback));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(dispatcher.dispatch(task("job-2"), callback));
        assertEquals(1, dispatcher.queuedCount());

        assertFalse(dispatcher.dispatch(task("job-3"), callback));
        assertFalse(dispatcher.isTracked("job-3"));
    }

    @Test
    @DisplayName("should signal a running job on cancel")
    void shouldCancelRunningJob() throws Exception {
        dispatcher.start();
        dispatcher.dispatch(task("job-1"), callback);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(dispatcher.cancel("job-1"));
        assertFalse(dispatcher.isTracked("job-1"));
        assertFalse(dispatcher.cancel("job-1"));

        verify(callback, timeout(5000)).onFailure(eq("job-1"), anyString());
        verify(callback, never()).onSuccess(anyString(), any());
    }

    @Test
    @DisplayName("should let in-flight jobs finish on a graceful stop")
    void shouldFinishInFlightJobsOnStop() throws Exception {
        dispatcher.start();
        dispatcher.dispatch(task("job-1"), callback);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        var stopped = dispatcher.stop(Duration.ofSeconds(5));
        assertFalse(dispatcher.isRunning());
        assertFalse(dispatcher.dispatch(task("job-2"), callback));

        release.countDown();
        stopped.get(5, TimeUnit.SECONDS);

        verify(callback).onSuccess(eq("job-1"), any(JsonNode.class));
        verify(callback, never()).onAbandoned(anyString(), anyString());
    }

    @Test
    @DisplayName("should abandon jobs that outlive the stop timeout")
    void shouldAbandonJobsAfterTimeout() throws Exception {
        dispatcher.start();
        dispatcher.dispatch(task("job-1"), callback);
        dispatcher.dispatch(task("job-2"), callback);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        dispatcher.stop(Duration.ofMillis(100)).get(10, TimeUnit.SECONDS);

        verify(callback).onAbandoned("job-1", ExecutorJobDispatcher.SHUTDOWN_MESSAGE);
        verify(callback).onAbandoned("job-2", ExecutorJobDispatcher.SHUTDOWN_MESSAGE);
        assertFalse(dispatcher.isTracked("job-1"));
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }
}
