package com.ivamare.ogcapi.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PreferHeader")
class PreferHeaderTest {

    @Test
    @DisplayName("should default to no preference")
    void shouldDefaultToNoPreference() {
        assertEquals(PreferHeader.none(), PreferHeader.parse(null));
        assertEquals(PreferHeader.none(), PreferHeader.parse(List.of()));
        assertEquals(Optional.empty(), PreferHeader.none().syncWait());
    }

    @Test
    @DisplayName("should read wait in seconds")
    void shouldReadWait() {
        PreferHeader header = PreferHeader.parse(List.of("wait=10"));

        assertFalse(header.respondAsync());
        assertEquals(Optional.of(Duration.ofSeconds(10)), header.syncWait());
    }

    @Test
    @DisplayName("should read several preferences in one or more headers")
    void shouldReadSeveralPreferences() {
        PreferHeader header = PreferHeader.parse(List.of("handling=lenient, Respond-Async", "wait=\"5\""));

        assertTrue(header.respondAsync());
        assertEquals(5L, header.waitSeconds());
        assertTrue(header.syncWait().isEmpty());
    }

    @Test
    @DisplayName("should ignore malformed or non-positive waits")
    void shouldIgnoreMalformedWait() {
        assertNull(PreferHeader.parse(List.of("wait=soon")).waitSeconds());
        assertTrue(PreferHeader.parse(List.of("wait=0")).syncWait().isEmpty());
    }

    @Test
    @DisplayName("should ignore preference parameters")
    void shouldIgnorePreferenceParameters() {
        assertTrue(PreferHeader.parse(List.of("respond-async; foo=bar")).respondAsync());
    }
}
