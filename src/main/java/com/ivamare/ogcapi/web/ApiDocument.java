package com.ivamare.ogcapi.web;

import com.ivamare.ogcapi.model.ConformanceDeclaration;
import com.ivamare.ogcapi.model.LandingPage;
import com.ivamare.ogcapi.model.Link;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Landing page and conformance declaration, assembled once from the API modules
 * and immutable afterwards.
 */
public final class ApiDocument {

    private static final Logger log = LoggerFactory.getLogger(ApiDocument.class);

    private final LandingPage landingPage;
    private final ConformanceDeclaration conformance;

    private ApiDocument(LandingPage landingPage, ConformanceDeclaration conformance) {
        this.landingPage = landingPage;
        this.conformance = conformance;
    }

    public static ApiDocument assemble(String title, String description, ApiLinks links, List<ApiModule> modules) {
        List<Link> landingLinks = new ArrayList<>();
        Set<String> conformsTo = new LinkedHashSet<>();
        for (ApiModule module : modules) {
            landingLinks.addAll(module.landingLinks(links));
            conformsTo.addAll(module.conformanceClasses());
        }

        log.info("Assembled API document from {} modules, {} conformance classes",
            modules.size(), conformsTo.size());

        return new ApiDocument(
            new LandingPage(title, description, List.copyOf(landingLinks)),
            new ConformanceDeclaration(List.copyOf(conformsTo))
        );
    }

    public LandingPage landingPage() {
        return landingPage;
    }

    public ConformanceDeclaration conformance() {
        return conformance;
    }
}
