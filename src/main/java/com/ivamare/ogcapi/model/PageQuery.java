package com.ivamare.ogcapi.model;

import com.ivamare.ogcapi.exception.InvalidPageQueryException;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Structured form of a listing request: page size, offset and every other query
 * parameter the client sent. Navigation links are re-derived from this object, never
 * from the raw request URL.
 *
 * @param limit Page size (positive, already clamped to the configured maximum)
 * @param offset Number of items to skip (zero or positive)
 * @param parameters Non-paging parameters, sorted by name
 */
public record PageQuery(int limit, int offset, Map<String, List<String>> parameters) {

    public static final String LIMIT = "limit";
    public static final String OFFSET = "offset";

    public PageQuery {
        if (limit < 1) {
            throw new InvalidPageQueryException(LIMIT, "limit must be a positive integer");
        }
        if (offset < 0) {
            throw new InvalidPageQueryException(OFFSET, "offset must be zero or a positive integer");
        }
        TreeMap<String, List<String>> sorted = new TreeMap<>();
        if (parameters != null) {
            parameters.forEach((name, values) -> sorted.put(name, List.copyOf(values)));
        }
        parameters = Collections.unmodifiableMap(sorted);
    }

    public static PageQuery of(int limit, int offset) {
        return new PageQuery(limit, offset, Map.of());
    }

    /**
     * Build a query from raw request parameters.
     *
     * @param requestParameters all query parameters of the request
     * @param defaultLimit limit used when the request has none
     * @param maxLimit larger limits are clamped to this value
     * @throws InvalidPageQueryException if limit or offset are malformed
     */
    public static PageQuery from(MultiValueMap<String, String> requestParameters, int defaultLimit, int maxLimit) {
        Integer limit = parseInteger(requestParameters.getFirst(LIMIT), LIMIT);
        Integer offset = parseInteger(requestParameters.getFirst(OFFSET), OFFSET);

        int effectiveLimit = limit != null ? limit : defaultLimit;
        if (effectiveLimit > maxLimit) {
            effectiveLimit = maxLimit;
        }

        Map<String, List<String>> others = new TreeMap<>();
        requestParameters.forEach((name, values) -> {
            if (!LIMIT.equals(name) && !OFFSET.equals(name)) {
                others.put(name, values);
            }
        });

        return new PageQuery(effectiveLimit, offset != null ? offset : 0, others);
    }

    public PageQuery withOffset(int newOffset) {
        return new PageQuery(limit, newOffset, parameters);
    }

    public List<String> parameter(String name) {
        return parameters.getOrDefault(name, List.of());
    }

    /**
     * Full query string parameters in a deterministic order: the non-paging
     * parameters sorted by name, then limit and offset.
     */
    public MultiValueMap<String, String> toQueryParameters() {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        parameters.forEach(params::addAll);
        params.add(LIMIT, Integer.toString(limit));
        params.add(OFFSET, Integer.toString(offset));
        return params;
    }

    private static Integer parseInteger(String raw, String name) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidPageQueryException(name, name + " must be an integer, got '" + raw + "'");
        }
    }
}
