package com.ivamare.ogcapi.web;

import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

/**
 * Absolute URLs of the API resources, rooted at the configured public URL.
 */
public class ApiLinks {

    private final String baseUrl;

    public ApiLinks(String publicUrl) {
        if (publicUrl == null || publicUrl.isBlank()) {
            throw new IllegalArgumentException("publicUrl must not be empty");
        }
        String trimmed = publicUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        this.baseUrl = trimmed;
    }

    public String root() {
        return baseUrl + "/";
    }

    public String conformance() {
        return path("conformance");
    }

    public String processes() {
        return path("processes");
    }

    public String process(String processId) {
        return path("processes", processId);
    }

    public String execution(String processId) {
        return path("processes", processId, "execution");
    }

    public String jobs() {
        return path("jobs");
    }

    public String job(String jobId) {
        return path("jobs", jobId);
    }

    public String results(String jobId) {
        return path("jobs", jobId, "results");
    }

    private String path(String... segments) {
        StringBuilder url = new StringBuilder(baseUrl);
        for (String segment : segments) {
            url.append('/').append(UriUtils.encodePathSegment(segment, StandardCharsets.UTF_8));
        }
        return url.toString();
    }
}
