package com.ivamare.ogcapi.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Catalog entry of a process. Links are computed when the entry is served and
 * are never read from storage.
 *
 * @param id Stable process identifier
 * @param title Short title
 * @param description Longer description (nullable)
 * @param version Process version
 * @param jobControlOptions Supported execution modes
 * @param outputTransmission Supported output delivery modes
 * @param links Navigation links (nullable until served)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProcessSummary(
    String id,
    String title,
    String description,
    String version,
    List<JobControlOption> jobControlOptions,
    List<TransmissionMode> outputTransmission,
    List<Link> links
) {
    public ProcessSummary {
        jobControlOptions = jobControlOptions == null
            ? List.of(JobControlOption.ASYNC_EXECUTE)
            : List.copyOf(jobControlOptions);
        outputTransmission = outputTransmission == null
            ? List.of(TransmissionMode.VALUE)
            : List.copyOf(outputTransmission);
        links = links == null ? null : List.copyOf(links);
    }

    public ProcessSummary withLinks(List<Link> newLinks) {
        return new ProcessSummary(id, title, description, version,
            jobControlOptions, outputTransmission, newLinks);
    }

    public boolean supports(JobControlOption option) {
        return jobControlOptions.contains(option);
    }
}
