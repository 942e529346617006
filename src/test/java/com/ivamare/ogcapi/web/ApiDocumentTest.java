package com.ivamare.ogcapi.web;

import com.ivamare.ogcapi.model.Link;
import com.ivamare.ogcapi.model.LinkRel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ApiDocument")
class ApiDocumentTest {

    private final ApiLinks links = new ApiLinks("http://localhost:8080");

    @Test
    @DisplayName("should gather links and conformance classes from every module")
    void shouldGatherFromModules() {
        ApiDocument document = ApiDocument.assemble("Title", "Description", links,
            List.of(new CoreApiModule(), new ProcessesApiModule()));

        List<String> rels = document.landingPage().links().stream().map(Link::rel).toList();
        assertEquals(List.of(LinkRel.SELF, LinkRel.CONFORMANCE, LinkRel.PROCESSES, LinkRel.JOB_LIST), rels);
        assertEquals("Title", document.landingPage().title());

        List<String> conformsTo = document.conformance().conformsTo();
        assertEquals(CoreApiModule.COMMON_CORE, conformsTo.get(0));
        assertTrue(conformsTo.containsAll(ProcessesApiModule.CONFORMANCE));
        assertEquals(6, conformsTo.size());
    }

    @Test
    @DisplayName("should list a conformance class once")
    void shouldDeduplicateConformanceClasses() {
        ApiDocument document = ApiDocument.assemble("Title", null, links,
            List.of(new CoreApiModule(), new CoreApiModule()));

        assertEquals(List.of(CoreApiModule.COMMON_CORE), document.conformance().conformsTo());
    }

    @Test
    @DisplayName("should be immutable once assembled")
    void shouldBeImmutable() {
        ApiDocument document = ApiDocument.assemble("Title", null, links, List.of(new CoreApiModule()));

        assertThrows(UnsupportedOperationException.class,
            () -> document.conformance().conformsTo().add("http://example.org/conf/extra"));
        assertThrows(UnsupportedOperationException.class,
            () -> document.landingPage().links().add(Link.of("http://example.org", "alternate")));
    }
}
