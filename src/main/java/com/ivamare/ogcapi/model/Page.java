package com.ivamare.ogcapi.model;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a listing plus the total number of matching items (ignoring paging).
 *
 * @param <T> item type
 */
public record Page<T>(List<T> items, long total) {

    public Page {
        items = List.copyOf(items);
    }

    public static <T> Page<T> empty() {
        return new Page<>(List.of(), 0);
    }

    public <R> Page<R> map(Function<T, R> mapper) {
        return new Page<>(items.stream().map(mapper).toList(), total);
    }
}
