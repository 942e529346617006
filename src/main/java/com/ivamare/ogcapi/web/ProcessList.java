package com.ivamare.ogcapi.web;

import com.ivamare.ogcapi.model.Link;
import com.ivamare.ogcapi.model.ProcessSummary;

import java.util.List;

public record ProcessList(List<ProcessSummary> processes, List<Link> links) {
}
