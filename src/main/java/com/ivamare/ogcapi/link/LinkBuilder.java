package com.ivamare.ogcapi.link;

import com.ivamare.ogcapi.model.Link;
import com.ivamare.ogcapi.model.LinkRel;
import com.ivamare.ogcapi.model.PageQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds self/prev/next links for any paginated listing.
 *
 * <p>The query string of every link is rebuilt from the structured {@link PageQuery}
 * (parameters sorted by name, then limit and offset, each value form-encoded), so
 * the links do not depend on how the incoming request was written and any
 * non-paging parameter is carried over unchanged.
 */
public class LinkBuilder {

    private static final Logger log = LoggerFactory.getLogger(LinkBuilder.class);

    /**
     * @param resourceUrl absolute URL of the listed resource, without query
     * @param query the structured listing query
     * @param totalCount number of matching items ignoring paging
     */
    public PageLinks build(String resourceUrl, PageQuery query, long totalCount) {
        int limit = query.limit();
        int offset = query.offset();

        Link self = Link.of(href(resourceUrl, query), LinkRel.SELF).withTitle("this document");

        Link prev = null;
        if (offset > 0) {
            PageQuery previous = query.withOffset(Math.max(0, offset - limit));
            prev = Link.of(href(resourceUrl, previous), LinkRel.PREV).withTitle("previous page");
        }

        Link next = null;
        if ((long) offset + limit < totalCount) {
            PageQuery following = query.withOffset(offset + limit);
            next = Link.of(href(resourceUrl, following), LinkRel.NEXT).withTitle("next page");
        }

        log.debug("Built page links for {} (limit={}, offset={}, total={}): prev={}, next={}",
            resourceUrl, limit, offset, totalCount, prev != null, next != null);

        return new PageLinks(self, prev, next);
    }

    /**
     * Absolute URL of the listing page described by {@code query}.
     */
    public String href(String resourceUrl, PageQuery query) {
        MultiValueMap<String, String> encoded = new LinkedMultiValueMap<>();
        query.toQueryParameters().forEach((name, values) ->
            values.forEach(value -> encoded.add(encode(name), encode(value))));

        return UriComponentsBuilder.fromUriString(resourceUrl)
            .replaceQueryParams(encoded)
            .build(true)
            .toUriString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
