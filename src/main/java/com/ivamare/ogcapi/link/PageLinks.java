package com.ivamare.ogcapi.link;

import com.ivamare.ogcapi.model.Link;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Navigation links of one page.
 *
 * @param self The page as requested
 * @param prev Previous page (nullable, present only when offset is greater than zero)
 * @param next Next page (nullable, present only when more items follow)
 */
public record PageLinks(Link self, Link prev, Link next) {

    public Optional<Link> previous() {
        return Optional.ofNullable(prev);
    }

    public Optional<Link> following() {
        return Optional.ofNullable(next);
    }

    public List<Link> asList() {
        List<Link> links = new ArrayList<>(3);
        links.add(self);
        if (prev != null) {
            links.add(prev);
        }
        if (next != null) {
            links.add(next);
        }
        return List.copyOf(links);
    }
}
