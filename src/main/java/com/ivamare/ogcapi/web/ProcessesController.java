package com.ivamare.ogcapi.web;

import com.ivamare.ogcapi.OgcApiProperties.PagingProperties;
import com.ivamare.ogcapi.lifecycle.JobLifecycleService;
import com.ivamare.ogcapi.link.LinkBuilder;
import com.ivamare.ogcapi.model.ExecuteRequest;
import com.ivamare.ogcapi.model.Job;
import com.ivamare.ogcapi.model.JobControlOption;
import com.ivamare.ogcapi.model.JobStatus;
import com.ivamare.ogcapi.model.Link;
import com.ivamare.ogcapi.model.LinkRel;
import com.ivamare.ogcapi.model.Page;
import com.ivamare.ogcapi.model.PageQuery;
import com.ivamare.ogcapi.model.ProcessDescription;
import com.ivamare.ogcapi.model.ProcessSummary;
import com.ivamare.ogcapi.process.ProcessRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Process catalog and execution endpoints.
 */
@RestController
public class ProcessesController {

    private static final Logger log = LoggerFactory.getLogger(ProcessesController.class);

    private final ProcessRegistry processRegistry;
    private final JobLifecycleService lifecycleService;
    private final LinkBuilder linkBuilder;
    private final ApiLinks apiLinks;
    private final PagingProperties paging;
    private final Duration syncTimeout;

    public ProcessesController(
            ProcessRegistry processRegistry,
            JobLifecycleService lifecycleService,
            LinkBuilder linkBuilder,
            ApiLinks apiLinks,
            PagingProperties paging,
            Duration syncTimeout) {
        this.processRegistry = processRegistry;
        this.lifecycleService = lifecycleService;
        this.linkBuilder = linkBuilder;
        this.apiLinks = apiLinks;
        this.paging = paging;
        this.syncTimeout = syncTimeout;
    }

    @GetMapping(value = "/processes", produces = MediaType.APPLICATION_JSON_VALUE)
    public ProcessList listProcesses(@RequestParam MultiValueMap<String, String> params) {
        PageQuery query = PageQuery.from(params, paging.getDefaultLimit(), paging.getMaxLimit());
        Page<ProcessSummary> page = processRegistry.list(query.limit(), query.offset());

        List<ProcessSummary> summaries = page.items().stream()
            .map(summary -> summary.withLinks(List.of(
                Link.of(apiLinks.process(summary.id()), LinkRel.SELF).withTitle("process description"))))
            .toList();

        return new ProcessList(summaries, linkBuilder.build(apiLinks.processes(), query, page.total()).asList());
    }

    @GetMapping(value = "/processes/{processId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ProcessDescription describeProcess(@PathVariable String processId) {
        ProcessDescription description = processRegistry.get(processId);
        return description.withLinks(List.of(
            Link.of(apiLinks.process(processId), LinkRel.SELF).withTitle("process description"),
            Link.of(apiLinks.execution(processId), LinkRel.EXECUTE).withTitle("execute endpoint")
        ));
    }

    /**
     * Create a job. Answers 202 with the job status, or 200 with the results when the
     * client asked to wait, the process allows synchronous execution and the job
     * succeeded within the wait.
     */
    @PostMapping(
        value = "/processes/{processId}/execution",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> execute(
            @PathVariable String processId,
            @RequestBody ExecuteRequest request,
            @RequestHeader(value = PreferHeader.NAME, required = false) List<String> prefer) {

        PreferHeader preference = PreferHeader.parse(prefer);
        Optional<Duration> wait = preference.syncWait()
            .filter(w -> processRegistry.get(processId).summary().supports(JobControlOption.SYNC_EXECUTE))
            .map(w -> w.compareTo(syncTimeout) > 0 ? syncTimeout : w);

        if (wait.isPresent()) {
            Job job = lifecycleService.submitAndWait(processId, request, wait.get());
            if (job.status() == JobStatus.SUCCESSFUL && job.results() != null) {
                log.debug("Job {} answered synchronously", job.jobId());
                return ResponseEntity.ok()
                    .header(PreferHeader.APPLIED, PreferHeader.WAIT + "=" + wait.get().toSeconds())
                    .location(URI.create(apiLinks.job(job.jobId())))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(job.results());
            }
            return accepted(job, null);
        }

        Job job = lifecycleService.submit(processId, request);
        return accepted(job, preference.respondAsync() ? PreferHeader.RESPOND_ASYNC : null);
    }

    private ResponseEntity<StatusInfo> accepted(Job job, String preferenceApplied) {
        ResponseEntity.BodyBuilder response = ResponseEntity.status(HttpStatus.ACCEPTED)
            .location(URI.create(apiLinks.job(job.jobId())))
            .contentType(MediaType.APPLICATION_JSON);
        if (preferenceApplied != null) {
            response.header(PreferHeader.APPLIED, preferenceApplied);
        }
        return response.body(StatusInfo.from(job.withoutResults(), apiLinks));
    }
}
