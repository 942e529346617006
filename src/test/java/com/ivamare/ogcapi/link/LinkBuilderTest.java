package com.ivamare.ogcapi.link;

import com.ivamare.ogcapi.model.Link;
import com.ivamare.ogcapi.model.LinkRel;
import com.ivamare.ogcapi.model.PageQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LinkBuilder")
class LinkBuilderTest {

    private static final String JOBS = "http://localhost:8080/jobs";

    private final LinkBuilder builder = new LinkBuilder();

    @Test
    @DisplayName("should omit prev on the first page")
    void shouldOmitPrevOnFirstPage() {
        PageLinks links = builder.build(JOBS, PageQuery.of(10, 0), 25);

        assertTrue(links.previous().isEmpty());
        assertEquals(JOBS + "?limit=10&offset=10", links.next().href());
        assertEquals(JOBS + "?limit=10&offset=0", links.self().href());
        assertEquals(LinkRel.SELF, links.self().rel());
    }

    @Test
    @DisplayName("should give both prev and next in the middle of the listing")
    void shouldGivePrevAndNextInTheMiddle() {
        PageLinks links = builder.build(JOBS, PageQuery.of(10, 10), 25);

        assertEquals(JOBS + "?limit=10&offset=0", links.prev().href());
        assertEquals(JOBS + "?limit=10&offset=20", links.next().href());
        assertEquals(3, links.asList().size());
    }

    @Test
    @DisplayName("should omit next on the last page")
    void shouldOmitNextOnLastPage() {
        PageLinks links = builder.build(JOBS, PageQuery.of(10, 20), 25);

        assertTrue(links.following().isEmpty());
        assertEquals(JOBS + "?limit=10&offset=10", links.prev().href());
    }

    @Test
    @DisplayName("should omit next when the page ends exactly at the total")
    void shouldOmitNextAtExactEnd() {
        PageLinks links = builder.build(JOBS, PageQuery.of(10, 10), 20);

        assertNull(links.next());
    }

    @Test
    @DisplayName("prev should never go below offset zero")
    void prevShouldClampAtZero() {
        PageLinks links = builder.build(JOBS, PageQuery.of(10, 3), 25);

        assertEquals(JOBS + "?limit=10&offset=0", links.prev().href());
    }

    @Test
    @DisplayName("should carry filter parameters into every link")
    void shouldCarryFilterParameters() {
        PageQuery query = new PageQuery(5, 5, Map.of(
            "status", List.of("running", "failed"),
            "processID", List.of("echo")));

        PageLinks links = builder.build(JOBS, query, 100);

        for (Link link : links.asList()) {
            UriComponents uri = UriComponentsBuilder.fromUriString(link.href()).build();
            assertEquals(List.of("echo"), uri.getQueryParams().get("processID"));
            assertEquals(List.of("running", "failed"), uri.getQueryParams().get("status"));
            assertEquals("5", uri.getQueryParams().getFirst("limit"));
        }
        assertEquals(JOBS + "?processID=echo&status=running&status=failed&limit=5&offset=10", links.next().href());
    }

    @Test
    @DisplayName("should encode reserved characters in parameter values")
    void shouldEncodeReservedCharacters() {
        PageQuery query = new PageQuery(10, 0, Map.of("processID", List.of("a&b=c")));

        String href = builder.href(JOBS, query);

        assertEquals(JOBS + "?processID=a%26b%3Dc&limit=10&offset=0", href);
    }

    @Test
    @DisplayName("following next then prev should return to the same page")
    void nextThenPrevShouldRoundTrip() {
        MultiValueMap<String, String> request = new LinkedMultiValueMap<>();
        request.add("limit", "10");
        request.add("offset", "10");
        request.add("status", "running");
        PageQuery start = PageQuery.from(request, 10, 1000);

        PageLinks first = builder.build(JOBS, start, 100);
        PageQuery atNext = PageQuery.from(queryOf(first.next()), 10, 1000);
        PageLinks second = builder.build(JOBS, atNext, 100);
        PageQuery backAgain = PageQuery.from(queryOf(second.prev()), 10, 1000);

        assertEquals(start, backAgain);
        assertEquals(first.self().href(), second.prev().href());
    }

    private static MultiValueMap<String, String> queryOf(Link link) {
        return UriComponentsBuilder.fromUriString(link.href()).build().getQueryParams();
    }
}
