package com.ivamare.ogcapi.model;

import java.util.List;

/**
 * Conformance classes the API implements.
 */
public record ConformanceDeclaration(List<String> conformsTo) {

    public ConformanceDeclaration {
        conformsTo = List.copyOf(conformsTo);
    }
}
