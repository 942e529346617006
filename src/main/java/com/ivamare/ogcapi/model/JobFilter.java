package com.ivamare.ogcapi.model;

import com.ivamare.ogcapi.exception.InvalidPageQueryException;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Restriction applied to a job listing. Empty collections mean "no restriction".
 *
 * @param processIds Only jobs of these processes
 * @param statuses Only jobs in these statuses
 */
public record JobFilter(List<String> processIds, Set<JobStatus> statuses) {

    public static final String PROCESS_ID = "processID";
    public static final String STATUS = "status";

    public JobFilter {
        processIds = processIds == null ? List.of() : List.copyOf(processIds);
        statuses = statuses == null || statuses.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(statuses));
    }

    public static JobFilter all() {
        return new JobFilter(List.of(), Set.of());
    }

    /**
     * Read the filter from the listing query ({@code processID} and {@code status},
     * both repeatable).
     *
     * @throws InvalidPageQueryException for an unknown status value
     */
    public static JobFilter from(PageQuery query) {
        EnumSet<JobStatus> statuses = EnumSet.noneOf(JobStatus.class);
        for (String raw : splitValues(query.parameter(STATUS))) {
            try {
                statuses.add(JobStatus.fromValue(raw));
            } catch (IllegalArgumentException e) {
                throw new InvalidPageQueryException(STATUS, e.getMessage());
            }
        }
        return new JobFilter(splitValues(query.parameter(PROCESS_ID)), statuses);
    }

    public boolean matches(Job job) {
        if (!processIds.isEmpty() && !processIds.contains(job.processId())) {
            return false;
        }
        return statuses.isEmpty() || statuses.contains(job.status());
    }

    public boolean isEmpty() {
        return processIds.isEmpty() && statuses.isEmpty();
    }

    // processID=a,b and processID=a&processID=b are equivalent
    private static List<String> splitValues(List<String> values) {
        return values.stream()
            .flatMap(v -> Arrays.stream(v.split(",")))
            .map(String::trim)
            .filter(v -> !v.isEmpty())
            .distinct()
            .toList();
    }
}
