package com.ivamare.ogcapi.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ivamare.ogcapi.model.Job;
import com.ivamare.ogcapi.model.JobStatus;
import com.ivamare.ogcapi.model.Link;
import com.ivamare.ogcapi.model.LinkRel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Job status document as served to clients. Never carries the result document.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusInfo(
    @JsonProperty("processID") String processId,
    String type,
    @JsonProperty("jobID") String jobId,
    JobStatus status,
    String message,
    Instant created,
    Instant started,
    Instant finished,
    Instant updated,
    Integer progress,
    List<Link> links
) {
    public static final String TYPE_PROCESS = "process";

    public static StatusInfo from(Job job, ApiLinks apiLinks) {
        List<Link> links = new ArrayList<>();
        links.add(Link.of(apiLinks.job(job.jobId()), LinkRel.SELF).withTitle("job status"));
        if (job.status() == JobStatus.SUCCESSFUL) {
            links.add(Link.of(apiLinks.results(job.jobId()), LinkRel.RESULTS).withTitle("job results"));
        }

        return new StatusInfo(
            job.processId(),
            TYPE_PROCESS,
            job.jobId(),
            job.status(),
            job.message(),
            job.created(),
            job.started(),
            job.finished(),
            job.updated(),
            job.progress(),
            List.copyOf(links)
        );
    }
}
