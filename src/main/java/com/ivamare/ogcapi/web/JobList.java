package com.ivamare.ogcapi.web;

import com.ivamare.ogcapi.model.Link;

import java.util.List;

public record JobList(List<StatusInfo> jobs, List<Link> links) {
}
