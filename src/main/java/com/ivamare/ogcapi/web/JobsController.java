package com.ivamare.ogcapi.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.ivamare.ogcapi.OgcApiProperties.PagingProperties;
import com.ivamare.ogcapi.lifecycle.JobLifecycleService;
import com.ivamare.ogcapi.link.LinkBuilder;
import com.ivamare.ogcapi.model.Job;
import com.ivamare.ogcapi.model.JobFilter;
import com.ivamare.ogcapi.model.Page;
import com.ivamare.ogcapi.model.PageQuery;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Job status, results, listing and dismissal endpoints.
 */
@RestController
public class JobsController {

    private final JobLifecycleService lifecycleService;
    private final LinkBuilder linkBuilder;
    private final ApiLinks apiLinks;
    private final PagingProperties paging;

    public JobsController(
            JobLifecycleService lifecycleService,
            LinkBuilder linkBuilder,
            ApiLinks apiLinks,
            PagingProperties paging) {
        this.lifecycleService = lifecycleService;
        this.linkBuilder = linkBuilder;
        this.apiLinks = apiLinks;
        this.paging = paging;
    }

    @GetMapping(value = "/jobs", produces = MediaType.APPLICATION_JSON_VALUE)
    public JobList listJobs(@RequestParam MultiValueMap<String, String> params) {
        PageQuery query = PageQuery.from(params, paging.getDefaultLimit(), paging.getMaxLimit());
        Page<Job> page = lifecycleService.listJobs(JobFilter.from(query), query);

        return new JobList(
            page.map(job -> StatusInfo.from(job, apiLinks)).items(),
            linkBuilder.build(apiLinks.jobs(), query, page.total()).asList()
        );
    }

    @GetMapping(value = "/jobs/{jobId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public StatusInfo getStatus(@PathVariable String jobId) {
        return StatusInfo.from(lifecycleService.getStatus(jobId), apiLinks);
    }

    @GetMapping(value = "/jobs/{jobId}/results", produces = MediaType.APPLICATION_JSON_VALUE)
    public JsonNode getResults(@PathVariable String jobId) {
        return lifecycleService.getResults(jobId);
    }

    @DeleteMapping("/jobs/{jobId}")
    public ResponseEntity<Void> dismiss(@PathVariable String jobId) {
        lifecycleService.dismiss(jobId);
        return ResponseEntity.noContent().build();
    }
}
