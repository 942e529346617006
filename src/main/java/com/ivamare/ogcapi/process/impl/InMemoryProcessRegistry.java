package com.ivamare.ogcapi.process.impl;

import com.ivamare.ogcapi.model.Page;
import com.ivamare.ogcapi.model.ProcessDescription;
import com.ivamare.ogcapi.model.ProcessSummary;
import com.ivamare.ogcapi.process.ProcessRegistry;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Process catalog fixed at construction, typically from the registered handlers.
 */
public class InMemoryProcessRegistry implements ProcessRegistry {

    private final Map<String, ProcessDescription> processes;

    public InMemoryProcessRegistry(Collection<ProcessDescription> descriptions) {
        Map<String, ProcessDescription> sorted = new TreeMap<>();
        for (ProcessDescription description : descriptions) {
            if (sorted.putIfAbsent(description.id(), description.withLinks(null)) != null) {
                throw new IllegalArgumentException("Duplicate process id: " + description.id());
            }
        }
        this.processes = sorted;
    }

    @Override
    public Page<ProcessSummary> list(int limit, int offset) {
        List<ProcessSummary> page = processes.values().stream()
            .skip(offset)
            .limit(limit)
            .map(ProcessDescription::summary)
            .toList();
        return new Page<>(page, processes.size());
    }

    @Override
    public Optional<ProcessDescription> find(String processId) {
        return Optional.ofNullable(processes.get(processId));
    }

    @Override
    public boolean exists(String processId) {
        return processes.containsKey(processId);
    }
}
