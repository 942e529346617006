package com.ivamare.ogcapi.web;

import com.ivamare.ogcapi.model.ConformanceDeclaration;
import com.ivamare.ogcapi.model.LandingPage;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class LandingController {

    private final ApiDocument apiDocument;

    public LandingController(ApiDocument apiDocument) {
        this.apiDocument = apiDocument;
    }

    @GetMapping(value = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public LandingPage landingPage() {
        return apiDocument.landingPage();
    }

    @GetMapping(value = "/conformance", produces = MediaType.APPLICATION_JSON_VALUE)
    public ConformanceDeclaration conformance() {
        return apiDocument.conformance();
    }
}
