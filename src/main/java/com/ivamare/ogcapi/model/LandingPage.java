package com.ivamare.ogcapi.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Root document of the API.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LandingPage(String title, String description, List<Link> links) {

    public LandingPage {
        links = List.copyOf(links);
    }
}
