package com.ivamare.ogcapi.process;

import com.ivamare.ogcapi.exception.ProcessNotFoundException;
import com.ivamare.ogcapi.model.Page;
import com.ivamare.ogcapi.model.ProcessDescription;
import com.ivamare.ogcapi.model.ProcessSummary;

import java.util.Optional;

/**
 * Read-only catalog of the processes this server offers. Entries are administered
 * out of band; links are never stored and are added by the web layer.
 */
public interface ProcessRegistry {

    /**
     * List process summaries ordered by process id.
     */
    Page<ProcessSummary> list(int limit, int offset);

    Optional<ProcessDescription> find(String processId);

    /**
     * @throws ProcessNotFoundException if no such process
     */
    default ProcessDescription get(String processId) {
        return find(processId).orElseThrow(() -> new ProcessNotFoundException(processId));
    }

    boolean exists(String processId);
}
