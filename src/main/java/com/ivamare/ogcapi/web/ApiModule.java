package com.ivamare.ogcapi.web;

import com.ivamare.ogcapi.model.Link;

import java.util.List;

/**
 * A feature of the API that advertises itself on the landing page and in the
 * conformance declaration. Modules are read once, when the {@link ApiDocument} is
 * assembled at startup.
 */
public interface ApiModule {

    /**
     * Links this module adds to the landing page.
     */
    List<Link> landingLinks(ApiLinks links);

    /**
     * Conformance class URIs this module implements.
     */
    List<String> conformanceClasses();
}
