package com.ivamare.ogcapi.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Navigation link as used throughout the OGC API documents.
 *
 * @param href Target URL
 * @param rel Relation type
 * @param type Media type of the target (nullable)
 * @param title Human readable title (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Link(String href, String rel, String type, String title) {

    public static final String JSON = "application/json";

    public static Link of(String href, String rel) {
        return new Link(href, rel, JSON, null);
    }

    public Link withTitle(String newTitle) {
        return new Link(href, rel, type, newTitle);
    }

    public Link withType(String newType) {
        return new Link(href, rel, newType, title);
    }
}
