package com.ivamare.ogcapi.handler;

import com.ivamare.ogcapi.model.ProcessDescription;

import java.util.List;
import java.util.Optional;

/**
 * Maps process ids to the handlers that execute them.
 */
public interface HandlerRegistry {

    /**
     * Register a handler under its description's process id.
     *
     * @throws com.ivamare.ogcapi.exception.HandlerAlreadyRegisteredException if a
     *         handler is already registered for that process
     */
    void register(ProcessHandler handler);

    Optional<ProcessHandler> get(String processId);

    /**
     * @throws com.ivamare.ogcapi.exception.HandlerNotFoundException if not found
     */
    ProcessHandler getOrThrow(String processId);

    boolean hasHandler(String processId);

    /**
     * Descriptions of all registered processes, ordered by process id.
     */
    List<ProcessDescription> descriptions();
}
