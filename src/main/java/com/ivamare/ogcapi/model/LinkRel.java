package com.ivamare.ogcapi.model;

/**
 * Link relation types.
 */
public final class LinkRel {

    private LinkRel() {
    }

    public static final String SELF = "self";
    public static final String PREV = "prev";
    public static final String NEXT = "next";
    public static final String MONITOR = "monitor";
    public static final String SERVICE_DESC = "service-desc";

    public static final String CONFORMANCE = "http://www.opengis.net/def/rel/ogc/1.0/conformance";
    public static final String PROCESSES = "http://www.opengis.net/def/rel/ogc/1.0/processes";
    public static final String JOB_LIST = "http://www.opengis.net/def/rel/ogc/1.0/job-list";
    public static final String EXECUTE = "http://www.opengis.net/def/rel/ogc/1.0/execute";
    public static final String RESULTS = "http://www.opengis.net/def/rel/ogc/1.0/results";
}
