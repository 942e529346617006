package com.ivamare.ogcapi.handler.impl;

import com.ivamare.ogcapi.exception.HandlerAlreadyRegisteredException;
import com.ivamare.ogcapi.exception.HandlerNotFoundException;
import com.ivamare.ogcapi.handler.HandlerRegistry;
import com.ivamare.ogcapi.handler.ProcessHandler;
import com.ivamare.ogcapi.model.ProcessDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of HandlerRegistry, populated from the ProcessHandler beans
 * of the application context.
 */
public class DefaultHandlerRegistry implements HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultHandlerRegistry.class);

    private final Map<String, ProcessHandler> handlers = new ConcurrentHashMap<>();

    public DefaultHandlerRegistry() {
    }

    public DefaultHandlerRegistry(List<ProcessHandler> initial) {
        initial.forEach(this::register);
    }

    @Override
    public void register(ProcessHandler handler) {
        String processId = handler.processId();
        if (processId == null || processId.isBlank()) {
            throw new IllegalArgumentException(
                "Handler " + handler.getClass().getName() + " has no process id");
        }
        if (handlers.putIfAbsent(processId, handler) != null) {
            throw new HandlerAlreadyRegisteredException(processId);
        }
        log.info("Registered handler {} for process {}", handler.getClass().getSimpleName(), processId);
    }

    @Override
    public Optional<ProcessHandler> get(String processId) {
        return Optional.ofNullable(handlers.get(processId));
    }

    @Override
    public ProcessHandler getOrThrow(String processId) {
        return get(processId).orElseThrow(() -> new HandlerNotFoundException(processId));
    }

    @Override
    public boolean hasHandler(String processId) {
        return handlers.containsKey(processId);
    }

    @Override
    public List<ProcessDescription> descriptions() {
        return handlers.values().stream()
            .map(ProcessHandler::description)
            .sorted(Comparator.comparing(ProcessDescription::id))
            .toList();
    }
}
