package com.ivamare.ogcapi.web;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Client execution preferences from the {@code Prefer} request header (RFC 7240):
 * {@code respond-async} and {@code wait=<seconds>}. Unknown preferences are ignored.
 *
 * @param respondAsync The client asked for an asynchronous answer
 * @param waitSeconds Seconds the client is willing to wait (nullable)
 */
public record PreferHeader(boolean respondAsync, Long waitSeconds) {

    public static final String NAME = "Prefer";
    public static final String APPLIED = "Preference-Applied";
    public static final String RESPOND_ASYNC = "respond-async";
    public static final String WAIT = "wait";

    public static PreferHeader none() {
        return new PreferHeader(false, null);
    }

    public static PreferHeader parse(List<String> headerValues) {
        if (headerValues == null || headerValues.isEmpty()) {
            return none();
        }

        boolean async = false;
        Long wait = null;
        for (String headerValue : headerValues) {
            for (String preference : headerValue.split(",")) {
                String token = preference.split(";")[0].trim().toLowerCase(Locale.ROOT);
                if (token.equals(RESPOND_ASYNC)) {
                    async = true;
                } else if (token.startsWith(WAIT + "=")) {
                    wait = parseSeconds(token.substring(WAIT.length() + 1));
                }
            }
        }
        return new PreferHeader(async, wait);
    }

    /**
     * The wait the client asked for, unless it also asked for an asynchronous answer.
     */
    public Optional<Duration> syncWait() {
        if (respondAsync || waitSeconds == null || waitSeconds <= 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofSeconds(waitSeconds));
    }

    private static Long parseSeconds(String value) {
        try {
            return Long.parseLong(value.replace("\"", "").trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
