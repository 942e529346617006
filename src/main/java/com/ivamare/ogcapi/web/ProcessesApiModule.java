package com.ivamare.ogcapi.web;

import com.ivamare.ogcapi.model.Link;
import com.ivamare.ogcapi.model.LinkRel;

import java.util.List;

/**
 * Processes, execution and job resources.
 */
public class ProcessesApiModule implements ApiModule {

    private static final String CONF = "http://www.opengis.net/spec/ogcapi-processes-1/1.0/conf/";

    public static final List<String> CONFORMANCE = List.of(
        CONF + "core",
        CONF + "ogc-process-description",
        CONF + "json",
        CONF + "job-list",
        CONF + "dismiss"
    );

    @Override
    public List<Link> landingLinks(ApiLinks links) {
        return List.of(
            Link.of(links.processes(), LinkRel.PROCESSES).withTitle("metadata about the processes"),
            Link.of(links.jobs(), LinkRel.JOB_LIST).withTitle("the list of jobs")
        );
    }

    @Override
    public List<String> conformanceClasses() {
        return CONFORMANCE;
    }
}
